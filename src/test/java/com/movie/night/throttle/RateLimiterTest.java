package com.movie.night.throttle;

import com.movie.night.metrics.MetricsService;
import com.movie.night.metrics.NoOpMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("RateLimiter Tests")
class RateLimiterTest {

    private FakeTimeSource time;

    @BeforeEach
    void setUp() {
        time = new FakeTimeSource();
    }

    @Nested
    @DisplayName("MinIntervalRateLimiter")
    class MinIntervalTests {

        private MinIntervalRateLimiter limiter(double jitter, MetricsService metrics) {
            ThrottleConfig config = new ThrottleConfig(Duration.ofMillis(400), Duration.ofMillis(300), true);
            return new MinIntervalRateLimiter(config, time, () -> jitter, metrics);
        }

        @Test
        @DisplayName("First call never waits")
        void testFirstCallImmediate() {
            limiter(0.0, new NoOpMetricsService()).acquire("provider");
            assertTrue(time.sleeps().isEmpty());
        }

        @Test
        @DisplayName("Back-to-back calls wait for the interval plus jitter")
        void testWaitsIntervalPlusJitter() {
            MetricsService metrics = mock(MetricsService.class);
            MinIntervalRateLimiter limiter = limiter(0.5, metrics);

            limiter.acquire("provider");
            limiter.acquire("provider");

            assertEquals(1, time.sleeps().size());
            assertEquals(Duration.ofMillis(550), time.sleeps().get(0));
            verify(metrics).recordThrottleWait("provider", Duration.ofMillis(550));
        }

        @Test
        @DisplayName("Elapsed time counts towards the interval")
        void testElapsedTimeCounts() {
            MinIntervalRateLimiter limiter = limiter(0.0, new NoOpMetricsService());

            limiter.acquire("provider");
            time.advance(Duration.ofMillis(300));
            limiter.acquire("provider");
            time.advance(Duration.ofMillis(500));
            limiter.acquire("provider");

            assertEquals(1, time.sleeps().size());
            assertEquals(Duration.ofMillis(100), time.sleeps().get(0));
        }

        @Test
        @DisplayName("Keys are paced independently")
        void testIndependentKeys() {
            MinIntervalRateLimiter limiter = limiter(0.0, new NoOpMetricsService());

            limiter.acquire("provider");
            limiter.acquire("trends");

            assertTrue(time.sleeps().isEmpty());
        }

        @Test
        @DisplayName("Interruption surfaces as ThrottleInterruptedException and keeps the flag")
        void testInterrupted() {
            TimeSource interrupting = new TimeSource() {
                @Override
                public long nanoTime() {
                    return 0L;
                }

                @Override
                public void sleep(Duration duration) throws InterruptedException {
                    throw new InterruptedException("stop");
                }
            };
            MinIntervalRateLimiter limiter = new MinIntervalRateLimiter(
                    ThrottleConfig.of(Duration.ofMillis(400)), interrupting, () -> 0.0, new NoOpMetricsService());

            limiter.acquire("provider");
            try {
                assertThrows(ThrottleInterruptedException.class, () -> limiter.acquire("provider"));
                assertTrue(Thread.currentThread().isInterrupted());
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Nested
    @DisplayName("TokenBucketRateLimiter")
    class TokenBucketTests {

        @Test
        @DisplayName("Allows a burst then refuses until tokens refill")
        void testBurstThenRefill() {
            TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(2, 1.0, time);

            assertTrue(limiter.tryAcquire("trends"));
            assertTrue(limiter.tryAcquire("trends"));
            assertFalse(limiter.tryAcquire("trends"));

            time.advance(Duration.ofSeconds(1));
            assertTrue(limiter.tryAcquire("trends"));
        }

        @Test
        @DisplayName("Blocking acquire sleeps until the next token")
        void testAcquireSleeps() {
            TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1, 2.0, time);

            limiter.acquire("trends");
            limiter.acquire("trends");

            assertFalse(time.sleeps().isEmpty());
            Duration slept = time.sleeps().stream().reduce(Duration.ZERO, Duration::plus);
            assertTrue(slept.toMillis() >= 499 && slept.toMillis() <= 505, "slept " + slept);
        }

        @Test
        @DisplayName("Tokens never exceed the burst size")
        void testCapacityCap() {
            TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(3, 10.0, time);
            time.advance(Duration.ofMinutes(1));
            assertEquals(3, limiter.availableTokens("trends"));
        }

        @Test
        @DisplayName("Should reject invalid parameters")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(0, 1.0));
            assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(1, 0.0));
        }
    }

    @Nested
    @DisplayName("RoutingRateLimiter")
    class RoutingTests {

        @Test
        @DisplayName("Keys go to their routed limiter, others to the fallback")
        void testRouting() {
            RateLimiter provider = mock(RateLimiter.class);
            RateLimiter fallback = mock(RateLimiter.class);
            RoutingRateLimiter router = RoutingRateLimiter.builder()
                    .route(provider, "provider", "trailer.provider")
                    .fallback(fallback)
                    .build();

            router.acquire("provider");
            router.acquire("trailer.provider");
            router.acquire("scraper");

            verify(provider).acquire("provider");
            verify(provider).acquire("trailer.provider");
            verify(fallback).acquire("scraper");
            verifyNoMoreInteractions(provider, fallback);
        }
    }

    @Test
    @DisplayName("Disabled throttles build a limiter that never waits")
    void testThrottleConfig() {
        assertInstanceOf(NoOpRateLimiter.class, ThrottleConfig.disabled().toRateLimiter());
        assertInstanceOf(MinIntervalRateLimiter.class, ThrottleConfig.metadataProvider().toRateLimiter());
        assertEquals(Duration.ofMillis(1200), ThrottleConfig.trends().minInterval());
        assertThrows(IllegalArgumentException.class,
                () -> new ThrottleConfig(Duration.ofMillis(-1), Duration.ZERO, true));
    }
}
