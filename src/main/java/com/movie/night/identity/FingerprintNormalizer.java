package com.movie.night.identity;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts one source's raw payload into a {@link MovieFingerprint}.
 * Implementations never throw on missing or malformed fields; such fields come back null.
 */
public interface FingerprintNormalizer {

    /**
     * The source whose payload shape this normalizer understands.
     */
    MetadataSource source();

    /**
     * Builds a fingerprint from the given payload. A null payload yields an empty fingerprint.
     */
    MovieFingerprint normalize(JsonNode payload);
}
