package com.movie.night.metrics;

import com.movie.night.model.MovieField;

import java.time.Duration;

/**
 * Interface for recording movie-night metrics.
 * Implementations can integrate with Micrometer or any other metrics system.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a registry.
 */
public interface MetricsService {

    void recordIdentityMatch(boolean match, double confidence);

    void recordTrailerResolution(String sourceTag, Duration duration);

    void incrementTrailerTierFailure(String tier);

    void recordEnrichmentDuration(boolean success, Duration duration);

    void incrementFieldFilled(MovieField field);

    void recordCombinedScore(double score);

    void recordBatchCompleted(String job, long succeeded, long failed);

    void recordThrottleWait(String key, Duration waited);

    void recordCacheHit();

    void recordCacheMiss();
}
