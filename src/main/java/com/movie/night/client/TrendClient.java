package com.movie.night.client;

import java.util.OptionalInt;

/**
 * Search-interest service.
 */
@FunctionalInterface
public interface TrendClient {

    /**
     * Mean search interest over the last seven days, 0-100, or empty when unavailable.
     */
    OptionalInt fetch7DayAverage(String term);
}
