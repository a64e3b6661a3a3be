package com.movie.night.similarity;

/**
 * Blend of the numeric and categorical halves of a pair similarity. Must sum to 1.
 *
 * @param numeric     weight of the cosine over scaled numeric features
 * @param categorical weight of the exact-match and label-overlap terms
 */
public record SimilarityWeights(double numeric, double categorical) {

    private static final double TOLERANCE = 1e-9;

    public SimilarityWeights {
        if (numeric < 0.0 || categorical < 0.0) {
            throw new IllegalArgumentException("weights must be non-negative");
        }
        if (Math.abs(numeric + categorical - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("weights must sum to 1.0, got " + (numeric + categorical));
        }
    }

    /**
     * 0.60 numeric, 0.40 categorical.
     */
    public static SimilarityWeights defaults() {
        return new SimilarityWeights(0.60, 0.40);
    }
}
