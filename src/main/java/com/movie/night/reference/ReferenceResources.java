package com.movie.night.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads JSON reference tables bundled under {@code /reference} on the classpath.
 */
public final class ReferenceResources {

    public static final String RELEASE_WINDOWS = "/reference/release-windows.json";
    public static final String RATING_SCHEMES = "/reference/rating-schemes.json";
    public static final String BASELINES = "/reference/baselines.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ReferenceResources() {
    }

    /**
     * @throws ReferenceDataException if the resource is absent or not valid JSON
     */
    public static JsonNode read(String resourcePath) {
        try (InputStream in = ReferenceResources.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new ReferenceDataException("Reference resource not found: " + resourcePath);
            }
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ReferenceDataException("Failed to read reference resource: " + resourcePath, e);
        }
    }
}
