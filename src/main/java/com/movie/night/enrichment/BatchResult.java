package com.movie.night.enrichment;

import com.movie.night.store.BatchJob;

import java.util.List;

/**
 * Result of one batch run.
 *
 * @param job       the job that ran
 * @param total     movies selected for the run
 * @param succeeded movies processed without error
 * @param failed    movies whose processing raised an error
 * @param aborted   true when a rate limit or interruption stopped the run early
 * @param errors    per-movie error messages
 */
public record BatchResult(
        BatchJob job,
        long total,
        long succeeded,
        long failed,
        boolean aborted,
        List<BatchError> errors
) {
    public BatchResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long processed() {
        return succeeded + failed;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param movieId the movie that failed
     * @param message the error message
     */
    public record BatchError(long movieId, String message) {}

    @Override
    public String toString() {
        return "BatchResult{job=" + job +
                ", total=" + total +
                ", succeeded=" + succeeded +
                ", failed=" + failed +
                ", aborted=" + aborted +
                ", errors=" + errors.size() + '}';
    }
}
