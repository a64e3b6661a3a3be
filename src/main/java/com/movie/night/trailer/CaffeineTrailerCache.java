package com.movie.night.trailer;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed trailer cache. Only resolutions that found a URL are stored.
 */
public class CaffeineTrailerCache implements TrailerCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineTrailerCache.class);

    private final Cache<String, TrailerResolution> cache;

    public CaffeineTrailerCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("trailer.cache.initialized maxSize={} ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<TrailerResolution> get(String title) {
        return Optional.ofNullable(cache.getIfPresent(TrailerCache.keyOf(title)));
    }

    @Override
    public void put(String title, TrailerResolution resolution) {
        if (resolution == null || !resolution.found()) {
            return;
        }
        cache.put(TrailerCache.keyOf(title), resolution);
    }

    @Override
    public void invalidate(String title) {
        cache.invalidate(TrailerCache.keyOf(title));
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("trailer.cache.cleared");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
