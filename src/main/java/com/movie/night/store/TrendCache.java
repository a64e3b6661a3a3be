package com.movie.night.store;

import java.time.LocalDate;
import java.util.OptionalInt;

/**
 * Search-interest values keyed by term and the calendar day they were fetched.
 */
public interface TrendCache {

    OptionalInt get(String term, LocalDate day);

    void put(String term, LocalDate day, int value);
}
