package com.movie.night.identity;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Looks up the normalizer registered for a {@link MetadataSource}.
 */
public class NormalizerRegistry {

    private final Map<MetadataSource, FingerprintNormalizer> normalizers = new EnumMap<>(MetadataSource.class);

    /**
     * Creates a registry holding the IMDb, OMDb and TMDb normalizers.
     */
    public static NormalizerRegistry withDefaults(TitleEmbedder embedder) {
        return new NormalizerRegistry()
                .register(new ImdbFingerprintNormalizer(embedder))
                .register(new OmdbFingerprintNormalizer(embedder))
                .register(new TmdbFingerprintNormalizer(embedder));
    }

    /**
     * Registers a normalizer, replacing any previous one for the same source.
     */
    public NormalizerRegistry register(FingerprintNormalizer normalizer) {
        Objects.requireNonNull(normalizer, "normalizer must not be null");
        normalizers.put(normalizer.source(), normalizer);
        return this;
    }

    /**
     * @throws IllegalArgumentException if nothing is registered for the source
     */
    public FingerprintNormalizer forSource(MetadataSource source) {
        FingerprintNormalizer normalizer = normalizers.get(source);
        if (normalizer == null) {
            throw new IllegalArgumentException("No normalizer registered for source " + source);
        }
        return normalizer;
    }

    public MovieFingerprint normalize(MetadataSource source, JsonNode payload) {
        return forSource(source).normalize(payload);
    }
}
