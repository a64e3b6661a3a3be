package com.movie.night.client;

import java.util.Optional;

/**
 * Video-site search. Results are raw video ids or URLs; callers validate them.
 */
public interface VideoSearchClient {

    /**
     * First result whose title matches the query exactly.
     */
    default Optional<String> searchExact(String query) {
        return searchFirstMatch(query, true, 1);
    }

    /**
     * First acceptable result, retrying transient failures up to {@code maxRetries} times.
     */
    Optional<String> searchFirstMatch(String query, boolean exact, int maxRetries);
}
