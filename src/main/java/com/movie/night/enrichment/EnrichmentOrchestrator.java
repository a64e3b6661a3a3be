package com.movie.night.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.movie.night.client.DetailScraper;
import com.movie.night.client.MetadataProviderClient;
import com.movie.night.client.ProviderMetadata;
import com.movie.night.client.RateLimitExceededException;
import com.movie.night.client.ScrapedDetails;
import com.movie.night.client.SecondaryMetadataClient;
import com.movie.night.client.SecondaryPayloads;
import com.movie.night.identity.HashingTitleEmbedder;
import com.movie.night.identity.IdentityMatch;
import com.movie.night.identity.IdentityMatcher;
import com.movie.night.identity.MetadataSource;
import com.movie.night.identity.MovieFingerprint;
import com.movie.night.identity.NormalizerRegistry;
import com.movie.night.logging.LogContext;
import com.movie.night.metrics.MetricsService;
import com.movie.night.metrics.NoOpMetricsService;
import com.movie.night.model.Movie;
import com.movie.night.model.MovieField;
import com.movie.night.model.RatingSample;
import com.movie.night.model.RatingSources;
import com.movie.night.store.MovieNotFoundException;
import com.movie.night.store.MovieStore;
import com.movie.night.throttle.NoOpRateLimiter;
import com.movie.night.throttle.RateLimiter;
import com.movie.night.throttle.ThrottleInterruptedException;
import com.movie.night.trailer.TrailerResolution;
import com.movie.night.trailer.TrailerResolver;
import com.movie.night.trailer.VideoUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Fills the missing fields of one movie from several sources in a fixed order:
 * <ol>
 *   <li>primary metadata provider (identity, descriptive fields, genres)</li>
 *   <li>secondary metadata provider (runtime, box office, plot), identity-checked</li>
 *   <li>detail scraper, for the primary rating sample</li>
 *   <li>trailer resolver</li>
 *   <li>fair trend scores</li>
 *   <li>combined score, always recomputed</li>
 * </ol>
 * Fields that already hold a value are never overwritten, so re-running enrichment only
 * repeats the score recomputation. Each step fails independently, except that a
 * {@link RateLimitExceededException} aborts the run and propagates to the caller.
 *
 * <pre>
 * EnrichmentOrchestrator orchestrator = EnrichmentOrchestrator.builder()
 *     .store(store)
 *     .provider(tmdb)
 *     .secondary(omdb)
 *     .trailerResolver(resolver)
 *     .scoreUpdater(scoreUpdater)
 *     .build();
 * EnrichmentReport report = orchestrator.enrichMovie(42L);
 * </pre>
 */
public class EnrichmentOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentOrchestrator.class);

    private static final Set<MovieField> PRIMARY_FIELDS = EnumSet.of(
            MovieField.YEAR, MovieField.RELEASE_WINDOW, MovieField.RATING_CERTIFICATION,
            MovieField.DURATION_SECONDS, MovieField.TRAILER_URL, MovieField.ORIGIN_COUNTRY,
            MovieField.BOX_OFFICE_ACTUAL, MovieField.FRANCHISE, MovieField.EXTERNAL_ID,
            MovieField.PROVIDER_ID);
    private static final Set<MovieField> SECONDARY_FIELDS =
            EnumSet.of(MovieField.DURATION_SECONDS, MovieField.BOX_OFFICE_ACTUAL, MovieField.PLOT);

    private final MovieStore store;
    private final MetadataProviderClient provider;
    private final SecondaryMetadataClient secondary;
    private final DetailScraper scraper;
    private final TrailerResolver trailerResolver;
    private final ScoreUpdater scoreUpdater;
    private final NormalizerRegistry normalizers;
    private final IdentityMatcher identityMatcher;
    private final RateLimiter rateLimiter;
    private final MetricsService metrics;

    private EnrichmentOrchestrator(Builder builder) {
        this.store = builder.store;
        this.provider = builder.provider;
        this.secondary = builder.secondary;
        this.scraper = builder.scraper;
        this.trailerResolver = builder.trailerResolver;
        this.scoreUpdater = builder.scoreUpdater;
        this.normalizers = builder.normalizers;
        this.identityMatcher = builder.identityMatcher;
        this.rateLimiter = builder.rateLimiter;
        this.metrics = builder.metrics;
    }

    /**
     * Enriches one movie.
     *
     * @throws MovieNotFoundException      if the store has no such movie
     * @throws RateLimitExceededException  if a provider refuses service
     * @throws ThrottleInterruptedException if interrupted while paced
     */
    public EnrichmentReport enrichMovie(long movieId) {
        Movie movie = store.findById(movieId).orElseThrow(() -> new MovieNotFoundException(movieId));
        long start = System.nanoTime();
        Run run = new Run(movieId, movie.getTitle());
        boolean completed = false;

        try (LogContext ctx = LogContext.forEnrichment(LogContext.currentRunId(), movieId)) {
            log.debug("enrichment.started movieId={} title='{}'", movieId, run.title);

            runStep(run, EnrichmentStep.PRIMARY_METADATA, () -> primaryMetadata(run));
            runStep(run, EnrichmentStep.SECONDARY_METADATA, () -> secondaryMetadata(run));
            runStep(run, EnrichmentStep.DETAIL_SCRAPER, () -> detailScraper(run));
            runStep(run, EnrichmentStep.TRAILER, () -> trailer(run));
            runStep(run, EnrichmentStep.TRENDS, () -> run.filled.addAll(scoreUpdater.fillMissingTrends(movieId)));
            runStep(run, EnrichmentStep.COMBINED_SCORE, () -> {
                OptionalDouble score = scoreUpdater.recalculateCombinedScore(movieId);
                run.combinedScore = score.isPresent() ? score.getAsDouble() : null;
            });

            EnrichmentReport report = new EnrichmentReport(movieId, run.filled, run.failed, run.combinedScore);
            completed = true;
            log.info("enrichment.completed movieId={} filled={} failed={} combinedScore={}",
                    movieId, report.filledFields(), report.failedSteps(), report.combinedScore());
            return report;
        } finally {
            metrics.recordEnrichmentDuration(completed && run.failed.isEmpty(),
                    Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private void runStep(Run run, EnrichmentStep step, Runnable body) {
        try {
            body.run();
        } catch (RateLimitExceededException e) {
            log.warn("enrichment.rateLimited movieId={} step={} provider={}", run.movieId, step, e.getProvider());
            throw e;
        } catch (ThrottleInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            run.failed.add(step);
            log.warn("enrichment.step.failed movieId={} step={} error={}", run.movieId, step, e.getMessage());
            log.debug("enrichment.step.failed stack", e);
        }
    }

    private void primaryMetadata(Run run) {
        if (!anyMissing(run, PRIMARY_FIELDS)) {
            return;
        }
        rateLimiter.acquire(ThrottleKeys.PRIMARY_PROVIDER);
        Optional<ProviderMetadata> metadata = provider.fetchMetadata(run.title);
        if (metadata.isEmpty()) {
            log.debug("enrichment.primary.empty movieId={}", run.movieId);
            return;
        }
        run.primaryPayload = metadata.get().rawPayload();
        for (Map.Entry<MovieField, Object> entry : metadata.get().fieldValues().entrySet()) {
            fillIfMissing(run, entry.getKey(), entry.getValue());
        }
        for (String genre : metadata.get().genres()) {
            store.linkGenre(run.movieId, genre);
        }
    }

    private void secondaryMetadata(Run run) {
        if (!anyMissing(run, SECONDARY_FIELDS)) {
            return;
        }
        Optional<JsonNode> payload = trustedSecondaryPayload(run);
        if (payload.isEmpty()) {
            return;
        }
        run.secondaryPayload = payload.get();
        fillIfMissing(run, MovieField.DURATION_SECONDS, SecondaryPayloads.runtimeSeconds(payload.get()).orElse(null));
        fillIfMissing(run, MovieField.BOX_OFFICE_ACTUAL, SecondaryPayloads.boxOffice(payload.get()).orElse(null));
        fillIfMissing(run, MovieField.PLOT, SecondaryPayloads.plot(payload.get()).orElse(null));
    }

    /**
     * A lookup by external id is trusted as is. A title lookup is only accepted when it
     * fingerprints as the same movie as the primary payload, or as the stored row when the
     * primary provider had nothing.
     */
    private Optional<JsonNode> trustedSecondaryPayload(Run run) {
        Movie movie = currentMovie(run);
        if (movie.getExternalId() != null && !movie.getExternalId().isBlank()) {
            rateLimiter.acquire(ThrottleKeys.SECONDARY_PROVIDER);
            Optional<JsonNode> byId = secondary.fetchById(movie.getExternalId());
            if (byId.isPresent()) {
                return byId;
            }
        }

        Integer runtimeMinutes = movie.getDurationSeconds() != null ? movie.getDurationSeconds() / 60 : null;
        rateLimiter.acquire(ThrottleKeys.SECONDARY_PROVIDER);
        Optional<JsonNode> byTitle = secondary.fetchByTitle(run.title, runtimeMinutes, movie.getYear());
        if (byTitle.isEmpty()) {
            return byTitle;
        }

        MovieFingerprint reference = run.primaryPayload != null
                ? normalizers.normalize(MetadataSource.TMDB, run.primaryPayload)
                : storedFingerprint(movie);
        MovieFingerprint candidate = normalizers.normalize(MetadataSource.OMDB, byTitle.get());
        IdentityMatch match = identityMatcher.sameMovie(reference, candidate);
        if (!match.isMatch()) {
            log.info("enrichment.secondary.rejected movieId={} confidence={}", run.movieId, match.confidence());
            return Optional.empty();
        }
        return byTitle;
    }

    /**
     * Fingerprints the stored row through the IMDb dataset normalizer, whose columns it mirrors.
     */
    private MovieFingerprint storedFingerprint(Movie movie) {
        ObjectNode row = JsonNodeFactory.instance.objectNode();
        row.put("tconst", movie.getExternalId());
        row.put("primaryTitle", movie.getTitle());
        if (movie.getDurationSeconds() != null) {
            row.put("runtimeMinutes", movie.getDurationSeconds() / 60);
        }
        if (movie.getYear() != null) {
            row.put("startYear", movie.getYear());
        }
        return normalizers.normalize(MetadataSource.IMDB, row);
    }

    private void detailScraper(Run run) {
        if (scraper == null || store.rating(run.movieId, RatingSources.IMDB).isPresent()) {
            return;
        }
        Optional<String> externalId = externalIdFor(run);
        if (externalId.isEmpty()) {
            log.debug("enrichment.scraper.skipped movieId={} reason=no_external_id", run.movieId);
            return;
        }

        rateLimiter.acquire(ThrottleKeys.SCRAPER);
        Optional<ScrapedDetails> details = scraper.fetchAll(externalId.get());
        if (details.isEmpty() || !details.get().hasRating()) {
            return;
        }
        ScrapedDetails scraped = details.get();
        RatingSample sample = scraped.histogram() != null && scraped.histogram().total() > 0
                ? RatingSample.ofHistogram(run.movieId, RatingSources.IMDB, scraped.histogram())
                : new RatingSample(run.movieId, RatingSources.IMDB, scraped.rating() * 10.0,
                        scraped.voteCount(), null);
        store.upsertRating(sample);
        log.debug("enrichment.scraper.rating movieId={} score={}", run.movieId, sample.score());
    }

    private Optional<String> externalIdFor(Run run) {
        String stored = currentMovie(run).getExternalId();
        if (stored != null && !stored.isBlank()) {
            return Optional.of(stored);
        }
        if (run.secondaryPayload != null) {
            return SecondaryPayloads.externalId(run.secondaryPayload);
        }
        rateLimiter.acquire(ThrottleKeys.SECONDARY_PROVIDER);
        return secondary.getExternalId(run.title);
    }

    private void trailer(Run run) {
        if (!store.isFieldMissing(run.movieId, MovieField.TRAILER_URL)) {
            return;
        }
        TrailerResolution resolution = trailerResolver.locateTrailer(run.title);
        if (resolution.found()) {
            fillIfMissing(run, MovieField.TRAILER_URL, resolution.url());
        }
    }

    private void fillIfMissing(Run run, MovieField field, Object value) {
        if (MovieField.isMissingValue(value) || !store.isFieldMissing(run.movieId, field)) {
            return;
        }
        if (field == MovieField.TRAILER_URL && !VideoUrls.isValid((String) value)) {
            log.debug("enrichment.trailer.invalid movieId={} url='{}'", run.movieId, value);
            return;
        }
        try {
            store.updateField(run.movieId, field, value);
        } catch (IllegalArgumentException e) {
            log.warn("enrichment.field.rejected movieId={} field={} error={}", run.movieId, field, e.getMessage());
            return;
        }
        run.filled.add(field);
        metrics.incrementFieldFilled(field);
    }

    private boolean anyMissing(Run run, Set<MovieField> fields) {
        return fields.stream().anyMatch(field -> store.isFieldMissing(run.movieId, field));
    }

    private Movie currentMovie(Run run) {
        return store.findById(run.movieId).orElseThrow(() -> new MovieNotFoundException(run.movieId));
    }

    /**
     * Mutable state of one enrichment run.
     */
    private static final class Run {
        private final long movieId;
        private final String title;
        private final List<MovieField> filled = new ArrayList<>();
        private final List<EnrichmentStep> failed = new ArrayList<>();
        private JsonNode primaryPayload;
        private JsonNode secondaryPayload;
        private Double combinedScore;

        private Run(long movieId, String title) {
            this.movieId = movieId;
            this.title = title;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MovieStore store;
        private MetadataProviderClient provider;
        private SecondaryMetadataClient secondary;
        private DetailScraper scraper;
        private TrailerResolver trailerResolver;
        private ScoreUpdater scoreUpdater;
        private NormalizerRegistry normalizers;
        private IdentityMatcher identityMatcher;
        private RateLimiter rateLimiter;
        private MetricsService metrics;

        public Builder store(MovieStore store) {
            this.store = store;
            return this;
        }

        public Builder provider(MetadataProviderClient provider) {
            this.provider = provider;
            return this;
        }

        public Builder secondary(SecondaryMetadataClient secondary) {
            this.secondary = secondary;
            return this;
        }

        /**
         * Optional; without a scraper the rating step is skipped.
         */
        public Builder scraper(DetailScraper scraper) {
            this.scraper = scraper;
            return this;
        }

        public Builder trailerResolver(TrailerResolver trailerResolver) {
            this.trailerResolver = trailerResolver;
            return this;
        }

        public Builder scoreUpdater(ScoreUpdater scoreUpdater) {
            this.scoreUpdater = scoreUpdater;
            return this;
        }

        /**
         * Defaults to {@link NormalizerRegistry#withDefaults} over a hashing embedder.
         */
        public Builder normalizers(NormalizerRegistry normalizers) {
            this.normalizers = normalizers;
            return this;
        }

        public Builder identityMatcher(IdentityMatcher identityMatcher) {
            this.identityMatcher = identityMatcher;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder metricsService(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public EnrichmentOrchestrator build() {
            Objects.requireNonNull(store, "store is required");
            Objects.requireNonNull(provider, "provider is required");
            Objects.requireNonNull(secondary, "secondary is required");
            Objects.requireNonNull(trailerResolver, "trailerResolver is required");
            Objects.requireNonNull(scoreUpdater, "scoreUpdater is required");
            if (normalizers == null) {
                normalizers = NormalizerRegistry.withDefaults(new HashingTitleEmbedder());
            }
            if (identityMatcher == null) {
                identityMatcher = new IdentityMatcher();
            }
            if (rateLimiter == null) {
                rateLimiter = new NoOpRateLimiter();
            }
            if (metrics == null) {
                metrics = new NoOpMetricsService();
            }
            return new EnrichmentOrchestrator(this);
        }
    }
}
