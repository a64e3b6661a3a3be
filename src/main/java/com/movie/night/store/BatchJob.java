package com.movie.night.store;

/**
 * Resumable batch jobs and the key each one checkpoints under.
 */
public enum BatchJob {
    /** Enrich every movie in ascending id order. */
    METADATA_REFRESH("meta_resume"),
    /** Resolve trailers for movies that have none. */
    TRAILER_REPAIR("url_resume");

    private final String checkpointKey;

    BatchJob(String checkpointKey) {
        this.checkpointKey = checkpointKey;
    }

    public String getCheckpointKey() {
        return checkpointKey;
    }
}
