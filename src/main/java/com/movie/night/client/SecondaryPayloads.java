package com.movie.night.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.movie.night.identity.FieldParsers;
import com.movie.night.model.RatingSources;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field extraction from OMDb-shaped payloads. {@code "N/A"} counts as absent.
 */
public final class SecondaryPayloads {

    private SecondaryPayloads() {
    }

    public static Optional<Integer> runtimeSeconds(JsonNode payload) {
        Integer minutes = FieldParsers.runtimeMinutes(payload, "Runtime");
        return Optional.ofNullable(minutes).map(m -> m * 60);
    }

    /**
     * Parses {@code "$1,234,567"}.
     */
    public static Optional<Long> boxOffice(JsonNode payload) {
        String raw = FieldParsers.text(payload, "BoxOffice");
        if (raw == null || !raw.startsWith("$")) {
            return Optional.empty();
        }
        return parseLong(raw.substring(1).replace(",", ""));
    }

    public static Optional<String> plot(JsonNode payload) {
        return Optional.ofNullable(FieldParsers.text(payload, "Plot"));
    }

    public static Optional<String> externalId(JsonNode payload) {
        return Optional.ofNullable(FieldParsers.text(payload, "imdbID"));
    }

    public static Optional<Integer> imdbVotes(JsonNode payload) {
        String raw = FieldParsers.text(payload, "imdbVotes");
        if (raw == null) {
            return Optional.empty();
        }
        return parseLong(raw.replace(",", "")).map(v -> (int) Math.min(v, Integer.MAX_VALUE));
    }

    /**
     * Ratings on a 0-100 scale: {@code imdbRating} times ten, the Rotten Tomatoes
     * percentage, and the Metascore. Absent or malformed ratings are left out.
     */
    public static Map<String, Double> ratings(JsonNode payload) {
        Map<String, Double> ratings = new LinkedHashMap<>();
        scoreOutOfTen(FieldParsers.text(payload, "imdbRating"))
                .ifPresent(v -> ratings.put(RatingSources.IMDB, v));
        if (payload != null) {
            for (JsonNode entry : payload.path("Ratings")) {
                if ("Rotten Tomatoes".equals(entry.path("Source").asText())) {
                    percent(entry.path("Value").asText(null))
                            .ifPresent(v -> ratings.put(RatingSources.RT_CRITIC, v));
                }
            }
        }
        metascore(FieldParsers.text(payload, "Metascore"))
                .ifPresent(v -> ratings.put(RatingSources.METACRITIC, v));
        return ratings;
    }

    static Optional<Double> scoreOutOfTen(String raw) {
        return parseDouble(raw)
                .filter(v -> v >= 0.0 && v <= 10.0)
                .map(v -> Math.round(v * 100.0) / 10.0);
    }

    static Optional<Double> percent(String raw) {
        if (raw == null || !raw.endsWith("%")) {
            return Optional.empty();
        }
        return parseDouble(raw.substring(0, raw.length() - 1)).filter(v -> v >= 0.0 && v <= 100.0);
    }

    /**
     * Accepts {@code "72"} or {@code "72/100"}.
     */
    static Optional<Double> metascore(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        int slash = raw.indexOf('/');
        String head = slash >= 0 ? raw.substring(0, slash) : raw;
        return parseDouble(head).filter(v -> v >= 0.0 && v <= 100.0);
    }

    private static Optional<Double> parseDouble(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Long> parseLong(String raw) {
        try {
            return Optional.of(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
