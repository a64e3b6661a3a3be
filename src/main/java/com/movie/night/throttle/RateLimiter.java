package com.movie.night.throttle;

/**
 * Paces calls to an external service. Each key is paced independently, so one limiter can
 * guard several endpoints or tiers.
 */
public interface RateLimiter {

    /**
     * Blocks until a call under {@code key} may proceed.
     *
     * @throws ThrottleInterruptedException if the waiting thread is interrupted
     */
    void acquire(String key);
}
