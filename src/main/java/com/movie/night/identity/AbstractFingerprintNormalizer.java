package com.movie.night.identity;

import java.util.Objects;

/**
 * Shared plumbing for normalizers: title embedding and fingerprint assembly.
 */
abstract class AbstractFingerprintNormalizer implements FingerprintNormalizer {

    private final TitleEmbedder embedder;

    protected AbstractFingerprintNormalizer(TitleEmbedder embedder) {
        this.embedder = Objects.requireNonNull(embedder, "embedder must not be null");
    }

    protected MovieFingerprint fingerprint(String externalId, String title, Integer runtimeMinutes,
                                           Integer releaseYear) {
        double[] embedding = title != null ? embedder.embed(title) : null;
        return new MovieFingerprint(source(), externalId, title, embedding, runtimeMinutes, releaseYear);
    }
}
