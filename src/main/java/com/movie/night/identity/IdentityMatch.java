package com.movie.night.identity;

/**
 * Outcome of comparing two fingerprints.
 *
 * @param isMatch    whether the fingerprints describe the same film
 * @param confidence weighted agreement of the available signals, 0.0 to 1.0
 */
public record IdentityMatch(boolean isMatch, double confidence) {

    public IdentityMatch {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }

    /**
     * Neither side carried a comparable signal.
     */
    public static IdentityMatch insufficientData() {
        return new IdentityMatch(false, 0.0);
    }
}
