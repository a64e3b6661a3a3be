package com.movie.night.trailer;

/**
 * Where a trailer was found, with the fixed confidence of that tier.
 */
public enum TrailerSource {
    DB("db", 1.00),
    DB_FUZZY("db_fuzzy", 0.90),
    PROVIDER("provider", 0.95),
    SECONDARY_EXACT("secondary_exact", 0.80),
    SECONDARY_FUZZY("secondary_fuzzy", 0.60),
    NONE("none", 0.0);

    private final String tag;
    private final double confidence;

    TrailerSource(String tag, double confidence) {
        this.tag = tag;
        this.confidence = confidence;
    }

    public String getTag() {
        return tag;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * Whether this tier calls out to a network service.
     */
    public boolean isNetworkTier() {
        return this == PROVIDER || this == SECONDARY_EXACT || this == SECONDARY_FUZZY;
    }
}
