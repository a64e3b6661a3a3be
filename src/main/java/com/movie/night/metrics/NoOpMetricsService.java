package com.movie.night.metrics;

import com.movie.night.model.MovieField;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordIdentityMatch(boolean match, double confidence) {
    }

    @Override
    public void recordTrailerResolution(String sourceTag, Duration duration) {
    }

    @Override
    public void incrementTrailerTierFailure(String tier) {
    }

    @Override
    public void recordEnrichmentDuration(boolean success, Duration duration) {
    }

    @Override
    public void incrementFieldFilled(MovieField field) {
    }

    @Override
    public void recordCombinedScore(double score) {
    }

    @Override
    public void recordBatchCompleted(String job, long succeeded, long failed) {
    }

    @Override
    public void recordThrottleWait(String key, Duration waited) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
