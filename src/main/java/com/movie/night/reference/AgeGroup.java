package com.movie.night.reference;

/**
 * Broad audience buckets derived from a local certification symbol.
 */
public enum AgeGroup {
    ALL_AGES("all_ages"),
    KIDS("kids"),
    TEEN("teen"),
    ADULT("adult"),
    UNKNOWN("unknown");

    private final String label;

    AgeGroup(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Under 7 all ages, under 13 kids, under 17 teen, otherwise adult.
     */
    public static AgeGroup forMinimumAge(int age) {
        if (age < 7) {
            return ALL_AGES;
        }
        if (age < 13) {
            return KIDS;
        }
        if (age < 17) {
            return TEEN;
        }
        return ADULT;
    }
}
