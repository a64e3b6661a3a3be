package com.movie.night.enrichment;

/**
 * Rate limiter keys for the services enrichment calls.
 */
public final class ThrottleKeys {

    public static final String PRIMARY_PROVIDER = "provider";
    public static final String SECONDARY_PROVIDER = "secondary";
    public static final String SCRAPER = "scraper";
    public static final String TRENDS = "trends";
    public static final String ACTORS = "actors";

    private ThrottleKeys() {
    }
}
