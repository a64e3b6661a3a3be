package com.movie.night.model;

import java.util.Arrays;

/**
 * Vote counts per star bucket, 1 through 10.
 */
public final class RatingHistogram {

    public static final int BUCKETS = 10;

    private final long[] counts;

    private RatingHistogram(long[] counts) {
        this.counts = counts;
    }

    /**
     * Creates a histogram from counts ordered by star, index 0 holding the 1-star count.
     *
     * @throws IllegalArgumentException if there are not exactly ten non-negative counts
     */
    public static RatingHistogram of(long... counts) {
        if (counts == null || counts.length != BUCKETS) {
            throw new IllegalArgumentException("histogram must have exactly " + BUCKETS + " buckets");
        }
        for (long c : counts) {
            if (c < 0) {
                throw new IllegalArgumentException("histogram counts must be non-negative");
            }
        }
        return new RatingHistogram(counts.clone());
    }

    public static RatingHistogram empty() {
        return new RatingHistogram(new long[BUCKETS]);
    }

    /**
     * Vote count for a star value between 1 and 10.
     */
    public long count(int star) {
        if (star < 1 || star > BUCKETS) {
            throw new IllegalArgumentException("star must be between 1 and " + BUCKETS);
        }
        return counts[star - 1];
    }

    public long total() {
        long sum = 0;
        for (long c : counts) {
            sum += c;
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RatingHistogram other)) return false;
        return Arrays.equals(counts, other.counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return "RatingHistogram" + Arrays.toString(counts);
    }
}
