package com.movie.night.identity;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalizes IMDb dataset rows ({@code title.basics} columns).
 */
public class ImdbFingerprintNormalizer extends AbstractFingerprintNormalizer {

    public ImdbFingerprintNormalizer(TitleEmbedder embedder) {
        super(embedder);
    }

    @Override
    public MetadataSource source() {
        return MetadataSource.IMDB;
    }

    @Override
    public MovieFingerprint normalize(JsonNode payload) {
        return fingerprint(
                FieldParsers.text(payload, "tconst"),
                FieldParsers.text(payload, "primaryTitle"),
                FieldParsers.runtimeMinutes(payload, "runtimeMinutes"),
                FieldParsers.year(payload, "startYear"));
    }
}
