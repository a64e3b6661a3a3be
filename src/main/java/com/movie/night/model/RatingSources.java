package com.movie.night.model;

/**
 * Canonical rating source names used as the second half of a rating key.
 */
public final class RatingSources {

    public static final String IMDB = "IMDB";
    public static final String TMDB = "TMDB";
    public static final String RT_CRITIC = "RT_CRITIC";
    public static final String RT_AUDIENCE = "RT_AUDIENCE";
    public static final String METACRITIC = "METACRITIC";

    private RatingSources() {
    }
}
