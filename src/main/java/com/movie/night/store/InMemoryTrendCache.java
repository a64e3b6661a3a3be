package com.movie.night.store;

import java.time.LocalDate;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTrendCache implements TrendCache {

    private final Map<Key, Integer> values = new ConcurrentHashMap<>();

    @Override
    public OptionalInt get(String term, LocalDate day) {
        Integer value = values.get(new Key(term, day));
        return value != null ? OptionalInt.of(value) : OptionalInt.empty();
    }

    @Override
    public void put(String term, LocalDate day, int value) {
        values.put(new Key(term, day), value);
    }

    private record Key(String term, LocalDate day) {
    }
}
