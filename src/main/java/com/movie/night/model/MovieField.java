package com.movie.night.model;

/**
 * Addressable columns of a {@link Movie}.
 * Used for field-level reads and writes against the movie store and for
 * reporting which fields an enrichment pass filled.
 */
public enum MovieField {
    TITLE(String.class, false),
    YEAR(Integer.class, false),
    ORIGIN_COUNTRY(String.class, false),
    FRANCHISE(String.class, false),
    EXTERNAL_ID(String.class, false),
    PROVIDER_ID(Long.class, false),
    PLOT(String.class, false),
    RELEASE_WINDOW(String.class, false),
    RATING_CERTIFICATION(String.class, false),
    DURATION_SECONDS(Integer.class, false),
    BOX_OFFICE_ACTUAL(Long.class, false),
    BOX_OFFICE_EXPECTED(Long.class, false),
    GOOGLE_TREND_SCORE(Double.class, true),
    ACTOR_TREND_SCORE(Double.class, true),
    COMBINED_SCORE(Double.class, true),
    TRAILER_URL(String.class, false);

    private final Class<?> valueType;
    private final boolean score;

    MovieField(Class<?> valueType, boolean score) {
        this.valueType = valueType;
        this.score = score;
    }

    public Class<?> getValueType() {
        return valueType;
    }

    /**
     * Score columns are constrained to {@code [0, 100]} when set.
     */
    public boolean isScore() {
        return score;
    }

    /**
     * A value is missing when it is null or a blank string.
     */
    public static boolean isMissingValue(Object value) {
        if (value == null) {
            return true;
        }
        return value instanceof String s && s.isBlank();
    }
}
