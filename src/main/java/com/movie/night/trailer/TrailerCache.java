package com.movie.night.trailer;

import java.util.Locale;
import java.util.Optional;

/**
 * Cache of successful trailer lookups, keyed by normalized title.
 */
public interface TrailerCache {

    Optional<TrailerResolution> get(String title);

    /**
     * Stores a resolution. Implementations ignore resolutions that found nothing.
     */
    void put(String title, TrailerResolution resolution);

    void invalidate(String title);

    void invalidateAll();

    CacheStats getStats();

    /**
     * Cache key for a title: trimmed and lower-cased.
     */
    static String keyOf(String title) {
        return title == null ? "" : title.trim().toLowerCase(Locale.ROOT);
    }
}
