package com.movie.night.identity;

/**
 * Metadata sources whose payloads can be reduced to a {@link MovieFingerprint}.
 */
public enum MetadataSource {
    /**
     * IMDb dataset rows ({@code tconst}, {@code primaryTitle}, {@code runtimeMinutes}, {@code startYear}).
     */
    IMDB,

    /**
     * OMDb API responses ({@code imdbID}, {@code Title}, {@code Runtime}, {@code Released}/{@code Year}).
     */
    OMDB,

    /**
     * TMDb movie details ({@code imdb_id}, {@code title}, {@code runtime}, {@code release_date}).
     */
    TMDB
}
