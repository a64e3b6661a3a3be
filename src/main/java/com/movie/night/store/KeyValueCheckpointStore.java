package com.movie.night.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link CheckpointStore} over a {@link KeyValueStore}. A cleared checkpoint is written as
 * {@code "0"}, which reads back as no checkpoint.
 */
public class KeyValueCheckpointStore implements CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(KeyValueCheckpointStore.class);

    static final String CLEARED = "0";

    private final KeyValueStore keyValueStore;

    public KeyValueCheckpointStore(KeyValueStore keyValueStore) {
        this.keyValueStore = Objects.requireNonNull(keyValueStore, "keyValueStore must not be null");
    }

    @Override
    public OptionalLong lastProcessed(BatchJob job) {
        Optional<String> stored = keyValueStore.get(job.getCheckpointKey());
        if (stored.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            long id = Long.parseLong(stored.get().trim());
            return id > 0 ? OptionalLong.of(id) : OptionalLong.empty();
        } catch (NumberFormatException e) {
            log.warn("checkpoint.unreadable job={} value='{}'", job, stored.get());
            return OptionalLong.empty();
        }
    }

    @Override
    public void save(BatchJob job, long movieId) {
        keyValueStore.put(job.getCheckpointKey(), Long.toString(movieId));
    }

    @Override
    public void clear(BatchJob job) {
        keyValueStore.put(job.getCheckpointKey(), CLEARED);
        log.debug("checkpoint.cleared job={}", job);
    }
}
