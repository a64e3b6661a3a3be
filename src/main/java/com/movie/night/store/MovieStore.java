package com.movie.night.store;

import com.movie.night.model.Movie;
import com.movie.night.model.MovieField;
import com.movie.night.model.RatingSample;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence facade for movies, their genre and theme links, and rating samples.
 * Reads return detached copies; all mutation goes through the field-level and link methods.
 */
public interface MovieStore {

    /**
     * Inserts a movie and returns its newly assigned id. Any id set on the builder is ignored.
     */
    long addMovie(Movie.Builder movie);

    Optional<Movie> findById(long movieId);

    /**
     * Finds a movie by its exact title, then by an exact alias.
     */
    Optional<Long> findIdByTitle(String title);

    void addAlias(long movieId, String alias);

    /**
     * Id to title for every stored movie, in id order.
     */
    Map<Long, String> titlesById();

    /**
     * Returns true if the movie does not exist or the field is null or blank.
     */
    boolean isFieldMissing(long movieId, MovieField field);

    /**
     * @throws MovieNotFoundException   if the movie does not exist
     * @throws IllegalArgumentException if the value is invalid for the field
     */
    void updateField(long movieId, MovieField field, Object value);

    void linkGenre(long movieId, String genre);

    Set<String> genres(long movieId);

    void linkTheme(long movieId, String theme);

    Set<String> themes(long movieId);

    /**
     * Inserts or replaces the sample keyed by {@code (movieId, source)}.
     */
    void upsertRating(RatingSample sample);

    Optional<RatingSample> rating(long movieId, String source);

    List<RatingSample> ratings(long movieId);

    /**
     * Ids greater than {@code resumeAfter}, ascending.
     */
    List<Long> movieIdsAfter(long resumeAfter);

    /**
     * Ids greater than {@code resumeAfter} whose field is missing, ascending.
     */
    List<Long> movieIdsMissing(MovieField field, long resumeAfter);

    /**
     * Share of stored movies per origin country. Movies without an origin are not counted.
     */
    Map<String, Double> catalogueShareByCountry();

    long count();
}
