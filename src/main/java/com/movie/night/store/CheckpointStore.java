package com.movie.night.store;

import java.util.OptionalLong;

/**
 * Last processed movie id per batch job.
 */
public interface CheckpointStore {

    /**
     * Returns empty when the job has no checkpoint or was cleared.
     */
    OptionalLong lastProcessed(BatchJob job);

    void save(BatchJob job, long movieId);

    void clear(BatchJob job);
}
