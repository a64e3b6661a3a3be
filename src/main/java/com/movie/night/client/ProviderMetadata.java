package com.movie.night.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.movie.night.model.MovieField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Movie fields and genres extracted from the metadata provider's details payload.
 * Every field is nullable; {@link #fieldValues()} lists only the present ones.
 */
public record ProviderMetadata(
        String title,
        Integer year,
        String releaseWindow,
        String ratingCertification,
        Integer durationSeconds,
        String trailerUrl,
        String originCountry,
        Long boxOfficeActual,
        String franchise,
        String externalId,
        Long providerId,
        List<String> genres,
        JsonNode rawPayload
) {
    public ProviderMetadata {
        genres = genres != null ? List.copyOf(genres) : List.of();
    }

    /**
     * Present values keyed by the movie column they fill, in column order.
     */
    public Map<MovieField, Object> fieldValues() {
        Map<MovieField, Object> values = new EnumMap<>(MovieField.class);
        putIfPresent(values, MovieField.TITLE, title);
        putIfPresent(values, MovieField.YEAR, year);
        putIfPresent(values, MovieField.RELEASE_WINDOW, releaseWindow);
        putIfPresent(values, MovieField.RATING_CERTIFICATION, ratingCertification);
        putIfPresent(values, MovieField.DURATION_SECONDS, durationSeconds);
        putIfPresent(values, MovieField.TRAILER_URL, trailerUrl);
        putIfPresent(values, MovieField.ORIGIN_COUNTRY, originCountry);
        putIfPresent(values, MovieField.BOX_OFFICE_ACTUAL, boxOfficeActual);
        putIfPresent(values, MovieField.FRANCHISE, franchise);
        putIfPresent(values, MovieField.EXTERNAL_ID, externalId);
        putIfPresent(values, MovieField.PROVIDER_ID, providerId);
        return Collections.unmodifiableMap(values);
    }

    private static void putIfPresent(Map<MovieField, Object> values, MovieField field, Object value) {
        if (!MovieField.isMissingValue(value)) {
            values.put(field, value);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String title;
        private Integer year;
        private String releaseWindow;
        private String ratingCertification;
        private Integer durationSeconds;
        private String trailerUrl;
        private String originCountry;
        private Long boxOfficeActual;
        private String franchise;
        private String externalId;
        private Long providerId;
        private List<String> genres;
        private JsonNode rawPayload;

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder year(Integer year) {
            this.year = year;
            return this;
        }

        public Builder releaseWindow(String releaseWindow) {
            this.releaseWindow = releaseWindow;
            return this;
        }

        public Builder ratingCertification(String ratingCertification) {
            this.ratingCertification = ratingCertification;
            return this;
        }

        public Builder durationSeconds(Integer durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder trailerUrl(String trailerUrl) {
            this.trailerUrl = trailerUrl;
            return this;
        }

        public Builder originCountry(String originCountry) {
            this.originCountry = originCountry;
            return this;
        }

        public Builder boxOfficeActual(Long boxOfficeActual) {
            this.boxOfficeActual = boxOfficeActual;
            return this;
        }

        public Builder franchise(String franchise) {
            this.franchise = franchise;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder providerId(Long providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder genres(List<String> genres) {
            this.genres = genres;
            return this;
        }

        public Builder rawPayload(JsonNode rawPayload) {
            this.rawPayload = rawPayload;
            return this;
        }

        public ProviderMetadata build() {
            return new ProviderMetadata(title, year, releaseWindow, ratingCertification, durationSeconds,
                    trailerUrl, originCountry, boxOfficeActual, franchise, externalId, providerId, genres,
                    rawPayload);
        }
    }
}
