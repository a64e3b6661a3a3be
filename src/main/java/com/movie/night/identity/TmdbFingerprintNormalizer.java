package com.movie.night.identity;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalizes TMDb movie-details responses.
 */
public class TmdbFingerprintNormalizer extends AbstractFingerprintNormalizer {

    public TmdbFingerprintNormalizer(TitleEmbedder embedder) {
        super(embedder);
    }

    @Override
    public MetadataSource source() {
        return MetadataSource.TMDB;
    }

    @Override
    public MovieFingerprint normalize(JsonNode payload) {
        return fingerprint(
                FieldParsers.text(payload, "imdb_id"),
                FieldParsers.text(payload, "title"),
                FieldParsers.runtimeMinutes(payload, "runtime"),
                FieldParsers.year(payload, "release_date"));
    }
}
