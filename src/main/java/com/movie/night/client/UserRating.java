package com.movie.night.client;

/**
 * Provider user score.
 *
 * @param average   mean vote on a 0-10 scale
 * @param voteCount number of votes behind the mean
 */
public record UserRating(double average, int voteCount) {

    public UserRating {
        if (average < 0.0 || average > 10.0) {
            throw new IllegalArgumentException("average must be between 0 and 10");
        }
        if (voteCount < 0) {
            throw new IllegalArgumentException("voteCount must be non-negative");
        }
    }
}
