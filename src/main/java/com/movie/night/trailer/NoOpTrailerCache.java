package com.movie.night.trailer;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpTrailerCache implements TrailerCache {

    @Override
    public Optional<TrailerResolution> get(String title) {
        return Optional.empty();
    }

    @Override
    public void put(String title, TrailerResolution resolution) {
        // no-op
    }

    @Override
    public void invalidate(String title) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
