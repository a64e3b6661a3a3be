package com.movie.night.store;

/**
 * Thrown when an operation names a movie id the store does not hold.
 */
public class MovieNotFoundException extends RuntimeException {

    private final long movieId;

    public MovieNotFoundException(long movieId) {
        super("Movie not found: " + movieId);
        this.movieId = movieId;
    }

    public long getMovieId() {
        return movieId;
    }
}
