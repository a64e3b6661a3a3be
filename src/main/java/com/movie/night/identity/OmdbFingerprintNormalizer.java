package com.movie.night.identity;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalizes OMDb responses. Runtime arrives as {@code "142 min"}; the year is taken from
 * {@code Released} when it starts with a year, otherwise from {@code Year}.
 */
public class OmdbFingerprintNormalizer extends AbstractFingerprintNormalizer {

    public OmdbFingerprintNormalizer(TitleEmbedder embedder) {
        super(embedder);
    }

    @Override
    public MetadataSource source() {
        return MetadataSource.OMDB;
    }

    @Override
    public MovieFingerprint normalize(JsonNode payload) {
        Integer year = FieldParsers.year(payload, "Released");
        if (year == null) {
            year = FieldParsers.year(payload, "Year");
        }
        return fingerprint(
                FieldParsers.text(payload, "imdbID"),
                FieldParsers.text(payload, "Title"),
                FieldParsers.runtimeMinutes(payload, "Runtime"),
                year);
    }
}
