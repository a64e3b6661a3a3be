package com.movie.night.enrichment;

import com.movie.night.model.MovieField;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Outcome of enriching one movie.
 *
 * @param movieId       the enriched movie
 * @param filledFields  fields that were missing and are now set, in fill order
 * @param failedSteps   steps that raised an error and were skipped
 * @param combinedScore combined score after the run, null when there are no rating samples
 */
public record EnrichmentReport(long movieId, List<MovieField> filledFields,
                               List<EnrichmentStep> failedSteps, Double combinedScore) {

    public EnrichmentReport {
        filledFields = filledFields != null ? List.copyOf(filledFields) : List.of();
        failedSteps = failedSteps != null ? List.copyOf(failedSteps) : List.of();
    }

    public boolean isSuccessful() {
        return failedSteps.isEmpty();
    }

    public boolean filledAnything() {
        return !filledFields.isEmpty();
    }

    public OptionalDouble combinedScoreValue() {
        return combinedScore != null ? OptionalDouble.of(combinedScore) : OptionalDouble.empty();
    }
}
