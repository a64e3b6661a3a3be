package com.movie.night.enrichment;

/**
 * Receives per-item progress from batch jobs.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed number of movies handled so far
     * @param total     number of movies in the batch
     * @param message   short description of the last item
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
