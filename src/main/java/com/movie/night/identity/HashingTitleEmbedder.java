package com.movie.night.identity;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic feature-hashing title embedder.
 * Hashes word tokens and padded character trigrams into a fixed number of buckets and
 * L2-normalizes the result, so identical titles embed identically and titles sharing most
 * of their characters land close together.
 */
public class HashingTitleEmbedder implements TitleEmbedder {

    public static final int DEFAULT_DIMENSIONS = 256;

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final double WORD_WEIGHT = 1.0;
    private static final double TRIGRAM_WEIGHT = 0.5;

    private final int dimensions;

    public HashingTitleEmbedder() {
        this(DEFAULT_DIMENSIONS);
    }

    public HashingTitleEmbedder(int dimensions) {
        if (dimensions < 16) {
            throw new IllegalArgumentException("dimensions must be at least 16");
        }
        this.dimensions = dimensions;
    }

    @Override
    public double[] embed(String title) {
        double[] vector = new double[dimensions];
        String normalized = normalize(title);
        if (normalized.isEmpty()) {
            return vector;
        }

        for (String word : normalized.split(" ")) {
            vector[bucket("w:" + word)] += WORD_WEIGHT;
        }
        String padded = " " + normalized + " ";
        for (int i = 0; i + 3 <= padded.length(); i++) {
            vector[bucket("t:" + padded.substring(i, i + 3))] += TRIGRAM_WEIGHT;
        }

        double norm = 0.0;
        for (double v : vector) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String getName() {
        return "FeatureHashing";
    }

    /**
     * Lower-cases, strips accents and collapses punctuation to single spaces.
     */
    static String normalize(String title) {
        if (title == null) {
            return "";
        }
        String stripped = DIACRITICS.matcher(Normalizer.normalize(title, Normalizer.Form.NFD)).replaceAll("");
        return NON_ALPHANUMERIC.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private int bucket(String feature) {
        return Math.floorMod(feature.hashCode(), dimensions);
    }
}
