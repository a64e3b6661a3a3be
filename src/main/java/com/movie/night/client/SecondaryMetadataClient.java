package com.movie.night.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;

/**
 * Secondary metadata provider (OMDb-shaped). Implementations only need the two payload
 * lookups; the field accessors read from the title lookup.
 */
public interface SecondaryMetadataClient {

    /**
     * Payload for an exact external id. A hit is trusted without further identity checks.
     */
    Optional<JsonNode> fetchById(String externalId);

    /**
     * Best payload for a title; runtime and year are optional hints for disambiguation.
     */
    Optional<JsonNode> fetchByTitle(String title, Integer runtimeMinutes, Integer year);

    default Optional<Integer> getRuntimeSeconds(String title) {
        return fetchByTitle(title, null, null).flatMap(SecondaryPayloads::runtimeSeconds);
    }

    default Optional<Long> getBoxOffice(String title) {
        return fetchByTitle(title, null, null).flatMap(SecondaryPayloads::boxOffice);
    }

    default Optional<String> getPlot(String title) {
        return fetchByTitle(title, null, null).flatMap(SecondaryPayloads::plot);
    }

    /**
     * Scores on a 0-100 scale keyed by canonical source name.
     */
    default Map<String, Double> getRatings(String title) {
        return fetchByTitle(title, null, null).map(SecondaryPayloads::ratings).orElse(Map.of());
    }

    default Optional<String> getExternalId(String title) {
        return fetchByTitle(title, null, null).flatMap(SecondaryPayloads::externalId);
    }
}
