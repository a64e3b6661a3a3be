package com.movie.night.model;

import java.util.Objects;

/**
 * Canonical persisted movie record.
 * Created when a title is first referenced and then mutated field by field
 * during enrichment and scoring. Genres and themes are links held by the store.
 */
public class Movie {
    private final long id;
    private String title;
    private Integer year;
    private String originCountry;
    private String franchise;
    private String externalId;
    private Long providerId;
    private String plot;
    private String releaseWindow;
    private String ratingCertification;
    private Integer durationSeconds;
    private Long boxOfficeActual;
    private Long boxOfficeExpected;
    private Double googleTrendScore;
    private Double actorTrendScore;
    private Double combinedScore;
    private String trailerUrl;

    private Movie(Builder builder) {
        if (builder.title == null || builder.title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        this.id = builder.id;
        this.title = builder.title;
        this.year = builder.year;
        this.originCountry = builder.originCountry;
        this.franchise = builder.franchise;
        this.externalId = builder.externalId;
        this.providerId = builder.providerId;
        this.plot = builder.plot;
        this.releaseWindow = builder.releaseWindow;
        this.ratingCertification = builder.ratingCertification;
        this.durationSeconds = builder.durationSeconds;
        this.boxOfficeActual = builder.boxOfficeActual;
        this.boxOfficeExpected = builder.boxOfficeExpected;
        this.googleTrendScore = checkScore(MovieField.GOOGLE_TREND_SCORE, builder.googleTrendScore);
        this.actorTrendScore = checkScore(MovieField.ACTOR_TREND_SCORE, builder.actorTrendScore);
        this.combinedScore = checkScore(MovieField.COMBINED_SCORE, builder.combinedScore);
        this.trailerUrl = builder.trailerUrl;
    }

    public long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public Integer getYear() {
        return year;
    }

    public String getOriginCountry() {
        return originCountry;
    }

    public String getFranchise() {
        return franchise;
    }

    public String getExternalId() {
        return externalId;
    }

    public Long getProviderId() {
        return providerId;
    }

    public String getPlot() {
        return plot;
    }

    public String getReleaseWindow() {
        return releaseWindow;
    }

    public String getRatingCertification() {
        return ratingCertification;
    }

    public Integer getDurationSeconds() {
        return durationSeconds;
    }

    public Long getBoxOfficeActual() {
        return boxOfficeActual;
    }

    public Long getBoxOfficeExpected() {
        return boxOfficeExpected;
    }

    public Double getGoogleTrendScore() {
        return googleTrendScore;
    }

    public Double getActorTrendScore() {
        return actorTrendScore;
    }

    public Double getCombinedScore() {
        return combinedScore;
    }

    public String getTrailerUrl() {
        return trailerUrl;
    }

    /**
     * Reads a column by its field identifier.
     */
    public Object get(MovieField field) {
        return switch (field) {
            case TITLE -> title;
            case YEAR -> year;
            case ORIGIN_COUNTRY -> originCountry;
            case FRANCHISE -> franchise;
            case EXTERNAL_ID -> externalId;
            case PROVIDER_ID -> providerId;
            case PLOT -> plot;
            case RELEASE_WINDOW -> releaseWindow;
            case RATING_CERTIFICATION -> ratingCertification;
            case DURATION_SECONDS -> durationSeconds;
            case BOX_OFFICE_ACTUAL -> boxOfficeActual;
            case BOX_OFFICE_EXPECTED -> boxOfficeExpected;
            case GOOGLE_TREND_SCORE -> googleTrendScore;
            case ACTOR_TREND_SCORE -> actorTrendScore;
            case COMBINED_SCORE -> combinedScore;
            case TRAILER_URL -> trailerUrl;
        };
    }

    /**
     * Writes a column by its field identifier.
     *
     * @throws IllegalArgumentException if the value has the wrong type, a score is
     *                                  outside {@code [0, 100]}, or the title is blank
     */
    public void set(MovieField field, Object value) {
        if (value != null && !field.getValueType().isInstance(value)) {
            throw new IllegalArgumentException(field + " expects " + field.getValueType().getSimpleName()
                    + " but got " + value.getClass().getSimpleName());
        }
        switch (field) {
            case TITLE -> {
                if (value == null || ((String) value).isBlank()) {
                    throw new IllegalArgumentException("title must not be blank");
                }
                title = (String) value;
            }
            case YEAR -> year = (Integer) value;
            case ORIGIN_COUNTRY -> originCountry = (String) value;
            case FRANCHISE -> franchise = (String) value;
            case EXTERNAL_ID -> externalId = (String) value;
            case PROVIDER_ID -> providerId = (Long) value;
            case PLOT -> plot = (String) value;
            case RELEASE_WINDOW -> releaseWindow = (String) value;
            case RATING_CERTIFICATION -> ratingCertification = (String) value;
            case DURATION_SECONDS -> durationSeconds = (Integer) value;
            case BOX_OFFICE_ACTUAL -> boxOfficeActual = (Long) value;
            case BOX_OFFICE_EXPECTED -> boxOfficeExpected = (Long) value;
            case GOOGLE_TREND_SCORE -> googleTrendScore = checkScore(field, (Double) value);
            case ACTOR_TREND_SCORE -> actorTrendScore = checkScore(field, (Double) value);
            case COMBINED_SCORE -> combinedScore = checkScore(field, (Double) value);
            case TRAILER_URL -> trailerUrl = (String) value;
        }
    }

    /**
     * Returns true if the column is null or a blank string.
     */
    public boolean isMissing(MovieField field) {
        return MovieField.isMissingValue(get(field));
    }

    /**
     * Returns a detached copy of this movie.
     */
    public Movie copy() {
        return toBuilder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .year(year)
                .originCountry(originCountry)
                .franchise(franchise)
                .externalId(externalId)
                .providerId(providerId)
                .plot(plot)
                .releaseWindow(releaseWindow)
                .ratingCertification(ratingCertification)
                .durationSeconds(durationSeconds)
                .boxOfficeActual(boxOfficeActual)
                .boxOfficeExpected(boxOfficeExpected)
                .googleTrendScore(googleTrendScore)
                .actorTrendScore(actorTrendScore)
                .combinedScore(combinedScore)
                .trailerUrl(trailerUrl);
    }

    private static Double checkScore(MovieField field, Double value) {
        if (value != null && (value.isNaN() || value < 0.0 || value > 100.0)) {
            throw new IllegalArgumentException(field + " must be null or within [0, 100], got " + value);
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long id;
        private String title;
        private Integer year;
        private String originCountry;
        private String franchise;
        private String externalId;
        private Long providerId;
        private String plot;
        private String releaseWindow;
        private String ratingCertification;
        private Integer durationSeconds;
        private Long boxOfficeActual;
        private Long boxOfficeExpected;
        private Double googleTrendScore;
        private Double actorTrendScore;
        private Double combinedScore;
        private String trailerUrl;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder year(Integer year) {
            this.year = year;
            return this;
        }

        public Builder originCountry(String originCountry) {
            this.originCountry = originCountry;
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

        public Builder plot(String plot) {
            this.plot = plot;
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

        public Builder boxOfficeActual(Long boxOfficeActual) {
            this.boxOfficeActual = boxOfficeActual;
            return this;
        }

        public Builder boxOfficeExpected(Long boxOfficeExpected) {
            this.boxOfficeExpected = boxOfficeExpected;
            return this;
        }

        public Builder googleTrendScore(Double googleTrendScore) {
            this.googleTrendScore = googleTrendScore;
            return this;
        }

        public Builder actorTrendScore(Double actorTrendScore) {
            this.actorTrendScore = actorTrendScore;
            return this;
        }

        public Builder combinedScore(Double combinedScore) {
            this.combinedScore = combinedScore;
            return this;
        }

        public Builder trailerUrl(String trailerUrl) {
            this.trailerUrl = trailerUrl;
            return this;
        }

        public Movie build() {
            return new Movie(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Movie movie = (Movie) o;
        return id == movie.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Movie{" +
                "id=" + id +
                ", title='" + title + '\'' +
                ", year=" + year +
                ", originCountry='" + originCountry + '\'' +
                ", combinedScore=" + combinedScore +
                '}';
    }
}
