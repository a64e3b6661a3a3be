package com.movie.night.client;

import com.movie.night.model.RatingHistogram;

/**
 * Details scraped from the primary ratings site.
 *
 * @param rating    mean rating on a 0-10 scale, or null
 * @param voteCount number of votes, or null
 * @param histogram per-star vote counts, or null
 */
public record ScrapedDetails(Double rating, Integer voteCount, RatingHistogram histogram) {

    public boolean hasRating() {
        return rating != null && rating >= 0.0 && rating <= 10.0;
    }
}
