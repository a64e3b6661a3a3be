package com.movie.night.similarity;

import java.util.Set;

/**
 * Jaccard similarity between label sets (genres, themes).
 * Computes |intersection| / |union|; two empty sets are identical.
 */
public final class JaccardSimilarity {

    private JaccardSimilarity() {
    }

    public static double compute(Set<String> a, Set<String> b) {
        Set<String> first = a != null ? a : Set.of();
        Set<String> second = b != null ? b : Set.of();
        if (first.isEmpty() && second.isEmpty()) {
            return 1.0;
        }
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (String label : first) {
            if (second.contains(label)) {
                intersectionSize++;
            }
        }
        // |union| = |A| + |B| - |intersection|
        int unionSize = first.size() + second.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }
}
