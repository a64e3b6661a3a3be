package com.movie.night.throttle;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sends each key to the limiter registered for it, or to a fallback limiter. Lets one
 * {@link RateLimiter} handed to a component pace several services at different rates.
 */
public class RoutingRateLimiter implements RateLimiter {

    private final Map<String, RateLimiter> routes;
    private final RateLimiter fallback;

    private RoutingRateLimiter(Builder builder) {
        this.routes = Map.copyOf(builder.routes);
        this.fallback = builder.fallback;
    }

    @Override
    public void acquire(String key) {
        routes.getOrDefault(key, fallback).acquire(key);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, RateLimiter> routes = new HashMap<>();
        private RateLimiter fallback = new NoOpRateLimiter();

        /**
         * Routes every listed key to {@code limiter}.
         */
        public Builder route(RateLimiter limiter, String... keys) {
            Objects.requireNonNull(limiter, "limiter must not be null");
            for (String key : keys) {
                routes.put(key, limiter);
            }
            return this;
        }

        public Builder fallback(RateLimiter fallback) {
            this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
            return this;
        }

        public RoutingRateLimiter build() {
            return new RoutingRateLimiter(this);
        }
    }
}
