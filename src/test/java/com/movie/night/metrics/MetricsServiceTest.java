package com.movie.night.metrics;

import com.movie.night.model.MovieField;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordIdentityMatch(true, 0.9);
                noOp.recordTrailerResolution("db", Duration.ofMillis(3));
                noOp.incrementTrailerTierFailure("provider");
                noOp.recordEnrichmentDuration(true, Duration.ofMillis(120));
                noOp.incrementFieldFilled(MovieField.PLOT);
                noOp.recordCombinedScore(72.5);
                noOp.recordBatchCompleted("METADATA_REFRESH", 10, 1);
                noOp.recordThrottleWait("provider", Duration.ofMillis(400));
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record identity confidence by outcome")
        void recordIdentityMatch() {
            metrics.recordIdentityMatch(true, 0.92);
            metrics.recordIdentityMatch(true, 0.88);
            metrics.recordIdentityMatch(false, 0.4);

            DistributionSummary matched = registry.find("movienight.identity.confidence")
                    .tag("match", "true")
                    .summary();

            assertNotNull(matched);
            assertEquals(2, matched.count());
            assertEquals(1.80, matched.totalAmount(), 1e-9);
        }

        @Test
        @DisplayName("Should time trailer lookups by source")
        void recordTrailerResolution() {
            metrics.recordTrailerResolution("db", Duration.ofMillis(2));
            metrics.recordTrailerResolution("provider", Duration.ofMillis(300));
            metrics.recordTrailerResolution("provider", Duration.ofMillis(100));

            Timer timer = registry.find("movienight.trailer.resolution").tag("source", "provider").timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(400.0, timer.totalTime(TimeUnit.MILLISECONDS), 1e-6);
        }

        @Test
        @DisplayName("Should count filled fields by name")
        void incrementFieldFilled() {
            metrics.incrementFieldFilled(MovieField.PLOT);
            metrics.incrementFieldFilled(MovieField.PLOT);
            metrics.incrementFieldFilled(MovieField.YEAR);

            Counter plot = registry.find("movienight.enrichment.field.filled").tag("field", "PLOT").counter();

            assertNotNull(plot);
            assertEquals(2.0, plot.count());
        }

        @Test
        @DisplayName("Should count batch items by outcome")
        void recordBatchCompleted() {
            metrics.recordBatchCompleted("TRAILER_REPAIR", 8, 2);
            metrics.recordBatchCompleted("TRAILER_REPAIR", 1, 0);

            Counter ok = registry.find("movienight.batch.items")
                    .tag("job", "TRAILER_REPAIR").tag("outcome", "success").counter();
            Counter ko = registry.find("movienight.batch.items")
                    .tag("job", "TRAILER_REPAIR").tag("outcome", "failure").counter();

            assertEquals(9.0, ok.count());
            assertEquals(2.0, ko.count());
        }

        @Test
        @DisplayName("Should record enrichment outcomes, scores and cache traffic")
        void recordMisc() {
            metrics.recordEnrichmentDuration(false, Duration.ofMillis(50));
            metrics.recordCombinedScore(70.0);
            metrics.recordCombinedScore(80.0);
            metrics.incrementTrailerTierFailure("secondary_exact");
            metrics.recordThrottleWait("trends", Duration.ofMillis(1200));
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(1, registry.find("movienight.enrichment.duration").tag("outcome", "failure").timer().count());
            assertEquals(150.0, registry.find("movienight.score.combined").summary().totalAmount(), 1e-9);
            assertEquals(1.0, registry.find("movienight.trailer.tier.failure").tag("tier", "secondary_exact")
                    .counter().count());
            assertEquals(1, registry.find("movienight.throttle.wait").tag("key", "trends").timer().count());
            assertEquals(2.0, registry.find("movienight.cache.hit").counter().count());
            assertEquals(1.0, registry.find("movienight.cache.miss").counter().count());
        }
    }
}
