package com.movie.night.similarity;

/**
 * Cosine similarity between numeric vectors.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * Computes {@code a·b / (|a| |b|)}. Returns 0.0 when either vector has zero norm.
     *
     * @throws IllegalArgumentException if the vectors differ in length
     */
    public static double compute(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("vectors must have equal length: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        double denominator = Math.sqrt(normA) * Math.sqrt(normB);
        return denominator == 0.0 ? 0.0 : dot / denominator;
    }

    /**
     * Cosine similarity clamped to {@code [0, 1]}.
     */
    public static double computeClamped(double[] a, double[] b) {
        return Math.max(0.0, Math.min(1.0, compute(a, b)));
    }
}
