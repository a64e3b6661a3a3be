package com.movie.night.throttle;

import java.time.Duration;
import java.util.Objects;

/**
 * Pacing for one external service.
 *
 * @param minInterval minimum gap between two calls under the same key
 * @param maxJitter   upper bound of the random delay added to each gap
 * @param enabled     whether calls are paced at all
 */
public record ThrottleConfig(Duration minInterval, Duration maxJitter, boolean enabled) {

    private static final Duration DEFAULT_JITTER = Duration.ofMillis(300);

    public ThrottleConfig {
        Objects.requireNonNull(minInterval, "minInterval must not be null");
        Objects.requireNonNull(maxJitter, "maxJitter must not be null");
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative");
        }
        if (maxJitter.isNegative()) {
            throw new IllegalArgumentException("maxJitter must not be negative");
        }
    }

    /**
     * Paced at {@code minInterval} plus up to 300 ms of jitter.
     */
    public static ThrottleConfig of(Duration minInterval) {
        return new ThrottleConfig(minInterval, DEFAULT_JITTER, true);
    }

    /**
     * Metadata provider pacing: 400 ms (about 2.5 requests per second).
     */
    public static ThrottleConfig metadataProvider() {
        return of(Duration.ofMillis(400));
    }

    /**
     * Secondary metadata pacing: 600 ms.
     */
    public static ThrottleConfig secondaryProvider() {
        return of(Duration.ofMillis(600));
    }

    /**
     * Trend service pacing: 1.2 s.
     */
    public static ThrottleConfig trends() {
        return of(Duration.ofMillis(1200));
    }

    public static ThrottleConfig disabled() {
        return new ThrottleConfig(Duration.ZERO, Duration.ZERO, false);
    }

    /**
     * Builds the limiter this configuration describes.
     */
    public RateLimiter toRateLimiter() {
        return enabled ? new MinIntervalRateLimiter(this) : new NoOpRateLimiter();
    }
}
