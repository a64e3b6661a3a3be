package com.movie.night.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import com.movie.night.client.MetadataProviderClient;
import com.movie.night.client.RateLimitExceededException;
import com.movie.night.client.SecondaryMetadataClient;
import com.movie.night.client.SecondaryPayloads;
import com.movie.night.client.UserRating;
import com.movie.night.logging.LogContext;
import com.movie.night.model.Movie;
import com.movie.night.model.MovieField;
import com.movie.night.model.RatingSample;
import com.movie.night.model.RatingSources;
import com.movie.night.store.MovieNotFoundException;
import com.movie.night.store.MovieStore;
import com.movie.night.throttle.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Refreshes the rating samples of a movie from the providers, fills its missing fair trend
 * scores and recomputes its combined score. Unlike enrichment, ratings are re-fetched even
 * when samples already exist, except that a histogram-backed sample is kept. The secondary
 * provider is asked by external id when the movie has one, otherwise by title.
 */
public class ScoreRefreshService {
    private static final Logger log = LoggerFactory.getLogger(ScoreRefreshService.class);

    private final MovieStore store;
    private final MetadataProviderClient provider;
    private final SecondaryMetadataClient secondary;
    private final ScoreUpdater scoreUpdater;
    private final RateLimiter rateLimiter;

    public ScoreRefreshService(MovieStore store, MetadataProviderClient provider,
                               SecondaryMetadataClient secondary, ScoreUpdater scoreUpdater,
                               RateLimiter rateLimiter) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.secondary = Objects.requireNonNull(secondary, "secondary must not be null");
        this.scoreUpdater = Objects.requireNonNull(scoreUpdater, "scoreUpdater must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
    }

    /**
     * @return the combined score after the refresh, empty when the movie has no samples
     * @throws MovieNotFoundException     if the store has no such movie
     * @throws RateLimitExceededException if a provider refuses service
     */
    public OptionalDouble refreshScoresAndTrends(long movieId) {
        Movie movie = store.findById(movieId).orElseThrow(() -> new MovieNotFoundException(movieId));
        String title = movie.getTitle();

        try (LogContext ctx = LogContext.forEnrichment(LogContext.currentRunId(), movieId).with("operation", "refresh")) {
            refreshProviderRating(movieId, title);
            refreshSecondaryRatings(movie);
            try {
                scoreUpdater.fillMissingTrends(movieId);
            } catch (RateLimitExceededException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("refresh.trends.failed movieId={} error={}", movieId, e.getMessage());
            }
            OptionalDouble score = scoreUpdater.recalculateCombinedScore(movieId);
            log.info("refresh.completed movieId={} combinedScore={}", movieId,
                    score.isPresent() ? score.getAsDouble() : null);
            return score;
        }
    }

    /**
     * Runs {@link #refreshScoresAndTrends(long)} for every movie without a Google trend score,
     * in id order. A failing movie is logged and skipped; a rate limit stops the sweep.
     *
     * @return number of movies refreshed
     */
    public int refreshMissingTrends() {
        List<Long> ids = store.movieIdsMissing(MovieField.GOOGLE_TREND_SCORE, 0L);
        int refreshed = 0;
        for (long id : ids) {
            try {
                refreshScoresAndTrends(id);
                refreshed++;
            } catch (RateLimitExceededException e) {
                log.warn("refresh.rateLimited movieId={} refreshed={} remaining={}",
                        id, refreshed, ids.size() - refreshed);
                throw e;
            } catch (MovieNotFoundException e) {
                log.warn("refresh.skipped movieId={} error={}", id, e.getMessage());
            }
        }
        log.info("refresh.missingTrends.completed candidates={} refreshed={}", ids.size(), refreshed);
        return refreshed;
    }

    private void refreshProviderRating(long movieId, String title) {
        try {
            rateLimiter.acquire(ThrottleKeys.PRIMARY_PROVIDER);
            Optional<UserRating> rating = provider.fetchUserRating(title);
            rating.ifPresent(r -> replaceRating(
                    RatingSample.of(movieId, RatingSources.TMDB, r.average() * 10.0, r.voteCount())));
        } catch (RateLimitExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("refresh.providerRating.failed movieId={} error={}", movieId, e.getMessage());
        }
    }

    private void refreshSecondaryRatings(Movie movie) {
        long movieId = movie.getId();
        try {
            rateLimiter.acquire(ThrottleKeys.SECONDARY_PROVIDER);
            String externalId = movie.getExternalId();
            Optional<JsonNode> payload = externalId != null && !externalId.isBlank()
                    ? secondary.fetchById(externalId)
                    : secondary.fetchByTitle(movie.getTitle(), null, null);
            if (payload.isEmpty()) {
                return;
            }
            Integer imdbVotes = SecondaryPayloads.imdbVotes(payload.get()).orElse(null);
            SecondaryPayloads.ratings(payload.get()).forEach((source, score) -> {
                Integer count = RatingSources.IMDB.equals(source) ? imdbVotes : null;
                replaceRating(new RatingSample(movieId, source, score, count, null));
            });
        } catch (RateLimitExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("refresh.secondaryRatings.failed movieId={} error={}", movieId, e.getMessage());
        }
    }

    /**
     * A sample backed by a vote histogram is never replaced by a bare score.
     */
    private void replaceRating(RatingSample sample) {
        if (!sample.hasHistogram()) {
            Optional<RatingSample> existing = store.rating(sample.movieId(), sample.source());
            if (existing.isPresent() && existing.get().hasHistogram()) {
                log.debug("refresh.rating.kept movieId={} source={} reason=histogram",
                        sample.movieId(), sample.source());
                return;
            }
        }
        store.upsertRating(sample);
    }
}
