package com.movie.night.store;

import java.util.Optional;

/**
 * Small string key/value table for run state that does not belong on a movie.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);
}
