package com.movie.night.enrichment;

/**
 * Enrichment steps in the order they run.
 */
public enum EnrichmentStep {
    PRIMARY_METADATA,
    SECONDARY_METADATA,
    DETAIL_SCRAPER,
    TRAILER,
    TRENDS,
    COMBINED_SCORE
}
