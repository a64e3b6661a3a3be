package com.movie.night.model;

import java.util.Locale;
import java.util.Objects;

/**
 * One rating contribution for a movie from one source.
 * {@code (movieId, source)} is the key; a later sample for the same pair replaces the earlier one.
 *
 * @param movieId     the rated movie
 * @param source      upper-cased source name, e.g. {@code IMDB}
 * @param score       mean score on a 0-100 scale
 * @param sampleCount number of votes or reviews behind the score, null if unknown
 * @param histogram   per-star vote counts when the source reports a distribution, else null
 */
public record RatingSample(long movieId, String source, double score, Integer sampleCount,
                           RatingHistogram histogram) {

    public RatingSample {
        Objects.requireNonNull(source, "source must not be null");
        if (source.isBlank()) {
            throw new IllegalArgumentException("source must not be blank");
        }
        source = source.trim().toUpperCase(Locale.ROOT);
        if (Double.isNaN(score) || score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("score must be within [0, 100], got " + score);
        }
        if (sampleCount != null && sampleCount < 0) {
            throw new IllegalArgumentException("sampleCount must be non-negative");
        }
    }

    public static RatingSample of(long movieId, String source, double score) {
        return new RatingSample(movieId, source, score, null, null);
    }

    public static RatingSample of(long movieId, String source, double score, int sampleCount) {
        return new RatingSample(movieId, source, score, sampleCount, null);
    }

    public static RatingSample ofHistogram(long movieId, String source, RatingHistogram histogram) {
        Objects.requireNonNull(histogram, "histogram must not be null");
        long total = histogram.total();
        double mean = 0.0;
        if (total > 0) {
            double sum = 0.0;
            for (int star = 1; star <= RatingHistogram.BUCKETS; star++) {
                sum += star * histogram.count(star);
            }
            mean = sum / total * 10.0;
        }
        return new RatingSample(movieId, source, mean, (int) Math.min(total, Integer.MAX_VALUE), histogram);
    }

    public boolean hasHistogram() {
        return histogram != null;
    }
}
