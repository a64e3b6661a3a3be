package com.movie.night.config;

import java.util.Optional;

/**
 * API keys for the external services. Passed explicitly to client constructors; never read
 * from the environment by the library. {@link #toString()} masks every key.
 *
 * @param metadataProviderKey primary metadata provider key, may be null
 * @param secondaryProviderKey secondary metadata provider key, may be null
 * @param videoSearchKey      video search key, may be null
 */
public record ProviderCredentials(String metadataProviderKey, String secondaryProviderKey, String videoSearchKey) {

    private static final String MASK = "****";

    public ProviderCredentials {
        metadataProviderKey = blankToNull(metadataProviderKey);
        secondaryProviderKey = blankToNull(secondaryProviderKey);
        videoSearchKey = blankToNull(videoSearchKey);
    }

    public static ProviderCredentials none() {
        return new ProviderCredentials(null, null, null);
    }

    public Optional<String> metadataProvider() {
        return Optional.ofNullable(metadataProviderKey);
    }

    public Optional<String> secondaryProvider() {
        return Optional.ofNullable(secondaryProviderKey);
    }

    public Optional<String> videoSearch() {
        return Optional.ofNullable(videoSearchKey);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String mask(String value) {
        return value == null ? "null" : MASK;
    }

    @Override
    public String toString() {
        return "ProviderCredentials{" +
                "metadataProviderKey=" + mask(metadataProviderKey) +
                ", secondaryProviderKey=" + mask(secondaryProviderKey) +
                ", videoSearchKey=" + mask(videoSearchKey) +
                '}';
    }
}
