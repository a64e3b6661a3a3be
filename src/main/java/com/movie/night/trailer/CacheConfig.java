package com.movie.night.trailer;

/**
 * Configuration for the trailer resolution cache.
 *
 * @param maxSize    maximum number of entries
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 2,000 entries kept for a day.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(2_000, 86_400, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }

    public TrailerCache toCache() {
        return enabled ? new CaffeineTrailerCache(this) : new NoOpTrailerCache();
    }
}
