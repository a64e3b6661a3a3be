package com.movie.night.throttle;

/**
 * Rate limiter that never waits.
 */
public class NoOpRateLimiter implements RateLimiter {

    @Override
    public void acquire(String key) {
    }
}
