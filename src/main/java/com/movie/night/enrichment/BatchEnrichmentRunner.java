package com.movie.night.enrichment;

import com.movie.night.client.RateLimitExceededException;
import com.movie.night.logging.LogContext;
import com.movie.night.metrics.MetricsService;
import com.movie.night.metrics.NoOpMetricsService;
import com.movie.night.model.Movie;
import com.movie.night.model.MovieField;
import com.movie.night.store.BatchJob;
import com.movie.night.store.CheckpointStore;
import com.movie.night.store.MovieNotFoundException;
import com.movie.night.store.MovieStore;
import com.movie.night.throttle.ThrottleInterruptedException;
import com.movie.night.trailer.TrailerResolution;
import com.movie.night.trailer.TrailerResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs resumable batch jobs over the catalogue, one movie at a time in ascending id order.
 * The last processed id is checkpointed after every movie. A completed run clears the
 * checkpoint; a run stopped by a rate limit keeps it so the next run resumes after it.
 */
public class BatchEnrichmentRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchEnrichmentRunner.class);

    private final MovieStore store;
    private final EnrichmentOrchestrator orchestrator;
    private final TrailerResolver trailerResolver;
    private final CheckpointStore checkpoints;
    private final MetricsService metrics;

    public BatchEnrichmentRunner(MovieStore store, EnrichmentOrchestrator orchestrator,
                                 TrailerResolver trailerResolver, CheckpointStore checkpoints) {
        this(store, orchestrator, trailerResolver, checkpoints, new NoOpMetricsService());
    }

    public BatchEnrichmentRunner(MovieStore store, EnrichmentOrchestrator orchestrator,
                                 TrailerResolver trailerResolver, CheckpointStore checkpoints,
                                 MetricsService metrics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.trailerResolver = Objects.requireNonNull(trailerResolver, "trailerResolver must not be null");
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public BatchResult run(BatchJob job, boolean full) {
        return run(job, full, ProgressCallback.NOOP);
    }

    /**
     * @param full when true, ignores the checkpoint and starts from the first movie
     */
    public BatchResult run(BatchJob job, boolean full, ProgressCallback callback) {
        Objects.requireNonNull(job, "job must not be null");
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;

        try (LogContext ctx = LogContext.forBatch(LogContext.generateRunId(), job.name())) {
            long resumeAfter = full ? 0L : checkpoints.lastProcessed(job).orElse(0L);
            List<Long> ids = selectIds(job, resumeAfter);
            log.info("batch.started job={} full={} resumeAfter={} total={}", job, full, resumeAfter, ids.size());

            long succeeded = 0;
            long failed = 0;
            boolean aborted = false;
            List<BatchResult.BatchError> errors = new ArrayList<>();

            for (long id : ids) {
                try {
                    String message = process(job, id);
                    succeeded++;
                    cb.onProgress(succeeded + failed, ids.size(), message);
                } catch (RateLimitExceededException e) {
                    aborted = true;
                    errors.add(new BatchResult.BatchError(id, e.getMessage()));
                    log.warn("batch.aborted job={} movieId={} provider={} reason=rate_limit",
                            job, id, e.getProvider());
                    break;
                } catch (ThrottleInterruptedException e) {
                    aborted = true;
                    errors.add(new BatchResult.BatchError(id, e.getMessage()));
                    log.warn("batch.aborted job={} movieId={} reason=interrupted", job, id);
                    break;
                } catch (RuntimeException e) {
                    failed++;
                    errors.add(new BatchResult.BatchError(id, e.getMessage()));
                    log.warn("batch.item.failed job={} movieId={} error={}", job, id, e.getMessage());
                    cb.onProgress(succeeded + failed, ids.size(), "failed " + id);
                }
                checkpoints.save(job, id);
            }

            if (!aborted) {
                checkpoints.clear(job);
            }
            metrics.recordBatchCompleted(job.name(), succeeded, failed);

            BatchResult result = new BatchResult(job, ids.size(), succeeded, failed, aborted, errors);
            log.info("batch.completed result={}", result);
            return result;
        }
    }

    private List<Long> selectIds(BatchJob job, long resumeAfter) {
        return switch (job) {
            case METADATA_REFRESH -> store.movieIdsAfter(resumeAfter);
            case TRAILER_REPAIR -> store.movieIdsMissing(MovieField.TRAILER_URL, resumeAfter);
        };
    }

    private String process(BatchJob job, long movieId) {
        return switch (job) {
            case METADATA_REFRESH -> {
                EnrichmentReport report = orchestrator.enrichMovie(movieId);
                yield "enriched " + movieId + " filled=" + report.filledFields().size();
            }
            case TRAILER_REPAIR -> repairTrailer(movieId);
        };
    }

    private String repairTrailer(long movieId) {
        Movie movie = store.findById(movieId).orElseThrow(() -> new MovieNotFoundException(movieId));
        if (!movie.isMissing(MovieField.TRAILER_URL)) {
            return "kept " + movieId;
        }
        TrailerResolution resolution = trailerResolver.locateTrailer(movie.getTitle());
        if (!resolution.found()) {
            return "none " + movieId;
        }
        store.updateField(movieId, MovieField.TRAILER_URL, resolution.url());
        metrics.incrementFieldFilled(MovieField.TRAILER_URL);
        return resolution.sourceTag() + " " + movieId;
    }
}
