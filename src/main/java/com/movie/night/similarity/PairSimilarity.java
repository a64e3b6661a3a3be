package com.movie.night.similarity;

/**
 * Similarity of one unordered pair of movies.
 *
 * @param movieIdA   first movie, in input order
 * @param movieIdB   second movie, in input order
 * @param similarity score in [0, 1], rounded to 3 decimals
 */
public record PairSimilarity(long movieIdA, long movieIdB, double similarity) {

    public PairSimilarity {
        if (Double.isNaN(similarity) || similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("similarity must be within [0, 1], got " + similarity);
        }
    }

    public boolean involves(long movieId) {
        return movieIdA == movieId || movieIdB == movieId;
    }
}
