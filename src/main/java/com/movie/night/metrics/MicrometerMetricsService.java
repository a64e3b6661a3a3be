package com.movie.night.metrics;

import com.movie.night.model.MovieField;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code movienight.identity.confidence} DistributionSummary (tag: match)</li>
 *   <li>{@code movienight.trailer.resolution} Timer (tag: source)</li>
 *   <li>{@code movienight.trailer.tier.failure} Counter (tag: tier)</li>
 *   <li>{@code movienight.enrichment.duration} Timer (tag: outcome)</li>
 *   <li>{@code movienight.enrichment.field.filled} Counter (tag: field)</li>
 *   <li>{@code movienight.score.combined} DistributionSummary</li>
 *   <li>{@code movienight.batch.items} Counter (tags: job, outcome)</li>
 *   <li>{@code movienight.throttle.wait} Timer (tag: key)</li>
 *   <li>{@code movienight.cache.hit} / {@code movienight.cache.miss} Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final DistributionSummary combinedScoreSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.combinedScoreSummary = DistributionSummary.builder("movienight.score.combined")
                .description("Distribution of recomputed combined scores")
                .register(registry);
        this.cacheHitCounter = Counter.builder("movienight.cache.hit")
                .description("Number of trailer cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("movienight.cache.miss")
                .description("Number of trailer cache misses")
                .register(registry);
    }

    @Override
    public void recordIdentityMatch(boolean match, double confidence) {
        String tag = String.valueOf(match);
        DistributionSummary summary = summaryCache.computeIfAbsent("identity:" + tag, k ->
                DistributionSummary.builder("movienight.identity.confidence")
                        .description("Confidence of fingerprint comparisons")
                        .tag("match", tag)
                        .register(registry));
        summary.record(confidence);
    }

    @Override
    public void recordTrailerResolution(String sourceTag, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("trailer:" + sourceTag, k ->
                Timer.builder("movienight.trailer.resolution")
                        .description("Duration of trailer lookups by winning tier")
                        .tag("source", sourceTag)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementTrailerTierFailure(String tier) {
        counter("tierFailure:" + tier, "movienight.trailer.tier.failure",
                "Trailer tiers that failed with an error", "tier", tier).increment();
    }

    @Override
    public void recordEnrichmentDuration(boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent("enrichment:" + outcome, k ->
                Timer.builder("movienight.enrichment.duration")
                        .description("Duration of single-movie enrichment passes")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementFieldFilled(MovieField field) {
        counter("filled:" + field.name(), "movienight.enrichment.field.filled",
                "Movie fields filled by enrichment", "field", field.name()).increment();
    }

    @Override
    public void recordCombinedScore(double score) {
        combinedScoreSummary.record(score);
    }

    @Override
    public void recordBatchCompleted(String job, long succeeded, long failed) {
        Counter ok = counterCache.computeIfAbsent("batch:" + job + ":success", k ->
                Counter.builder("movienight.batch.items")
                        .description("Batch items processed")
                        .tag("job", job)
                        .tag("outcome", "success")
                        .register(registry));
        Counter ko = counterCache.computeIfAbsent("batch:" + job + ":failure", k ->
                Counter.builder("movienight.batch.items")
                        .description("Batch items processed")
                        .tag("job", job)
                        .tag("outcome", "failure")
                        .register(registry));
        ok.increment(succeeded);
        ko.increment(failed);
    }

    @Override
    public void recordThrottleWait(String key, Duration waited) {
        Timer timer = timerCache.computeIfAbsent("throttle:" + key, k ->
                Timer.builder("movienight.throttle.wait")
                        .description("Time spent waiting on rate limiters")
                        .tag("key", key)
                        .register(registry));
        timer.record(waited);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String cacheKey, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(cacheKey, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
