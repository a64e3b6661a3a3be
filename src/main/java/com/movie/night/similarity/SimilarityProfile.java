package com.movie.night.similarity;

import com.movie.night.model.Movie;
import com.movie.night.reference.AgeGroup;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * What the group similarity engine compares for one movie.
 *
 * @param movieId         movie id
 * @param numericFeatures scaled numeric features, see {@link #numericFeatures(Movie)}
 * @param releaseWindow   release window label, may be null
 * @param ageGroup        age group derived from the certification
 * @param originCountry   origin country, may be null
 * @param genres          genre labels
 * @param themes          theme labels
 */
public record SimilarityProfile(long movieId, double[] numericFeatures, String releaseWindow,
                                AgeGroup ageGroup, String originCountry,
                                Set<String> genres, Set<String> themes) {

    static final int BASE_YEAR = 2000;
    static final double YEAR_SCALE = 50.0;
    static final double SECONDS_PER_HOUR = 3600.0;
    static final double PERCENT = 100.0;

    public SimilarityProfile {
        Objects.requireNonNull(numericFeatures, "numericFeatures must not be null");
        numericFeatures = numericFeatures.clone();
        ageGroup = ageGroup != null ? ageGroup : AgeGroup.UNKNOWN;
        genres = genres != null ? Set.copyOf(genres) : Set.of();
        themes = themes != null ? Set.copyOf(themes) : Set.of();
    }

    public static SimilarityProfile of(Movie movie, AgeGroup ageGroup, Set<String> genres, Set<String> themes) {
        return new SimilarityProfile(movie.getId(), numericFeatures(movie), movie.getReleaseWindow(),
                ageGroup, movie.getOriginCountry(), genres, themes);
    }

    /**
     * {@code [(year - 2000) / 50, seconds / 3600, log10(max(boxOffice, 1)), trend / 100,
     * combined / 100, actorTrend / 100]}. Missing values contribute 0; a missing year counts
     * as 2000.
     */
    public static double[] numericFeatures(Movie movie) {
        int year = movie.getYear() != null ? movie.getYear() : BASE_YEAR;
        Long boxOffice = movie.getBoxOfficeActual();
        return new double[]{
                (year - BASE_YEAR) / YEAR_SCALE,
                orZero(movie.getDurationSeconds()) / SECONDS_PER_HOUR,
                boxOffice != null && boxOffice != 0 ? Math.log10(Math.max(boxOffice, 1L)) : 0.0,
                orZero(movie.getGoogleTrendScore()) / PERCENT,
                orZero(movie.getCombinedScore()) / PERCENT,
                orZero(movie.getActorTrendScore()) / PERCENT
        };
    }

    @Override
    public double[] numericFeatures() {
        return numericFeatures.clone();
    }

    private static double orZero(Number value) {
        return value != null ? value.doubleValue() : 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimilarityProfile that)) return false;
        return movieId == that.movieId
                && Arrays.equals(numericFeatures, that.numericFeatures)
                && Objects.equals(releaseWindow, that.releaseWindow)
                && ageGroup == that.ageGroup
                && Objects.equals(originCountry, that.originCountry)
                && genres.equals(that.genres)
                && themes.equals(that.themes);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(movieId, releaseWindow, ageGroup, originCountry, genres, themes);
        return 31 * result + Arrays.hashCode(numericFeatures);
    }

    @Override
    public String toString() {
        return "SimilarityProfile{movieId=" + movieId +
                ", numericFeatures=" + Arrays.toString(numericFeatures) +
                ", releaseWindow=" + releaseWindow +
                ", ageGroup=" + ageGroup +
                ", originCountry=" + originCountry +
                ", genres=" + genres +
                ", themes=" + themes + '}';
    }
}
