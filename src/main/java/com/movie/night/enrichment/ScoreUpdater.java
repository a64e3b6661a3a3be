package com.movie.night.enrichment;

import com.movie.night.client.ActorPopularityClient;
import com.movie.night.client.TrendClient;
import com.movie.night.metrics.MetricsService;
import com.movie.night.model.Movie;
import com.movie.night.model.MovieField;
import com.movie.night.scoring.FairnessScoringEngine;
import com.movie.night.store.MovieNotFoundException;
import com.movie.night.store.MovieStore;
import com.movie.night.throttle.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Writes the fair trend scores and the combined score of a movie. Shared by the enrichment
 * orchestrator and the score refresh service.
 */
public class ScoreUpdater {
    private static final Logger log = LoggerFactory.getLogger(ScoreUpdater.class);

    private final MovieStore store;
    private final FairnessScoringEngine scoringEngine;
    private final TrendClient trendClient;
    private final ActorPopularityClient actorClient;
    private final RateLimiter rateLimiter;
    private final MetricsService metrics;

    /**
     * @param trendClient trend service, null to leave Google trend scores alone; paces its own
     *                    calls so that cached answers are not throttled
     * @param actorClient actor popularity service, null to leave actor trend scores alone
     */
    public ScoreUpdater(MovieStore store, FairnessScoringEngine scoringEngine, TrendClient trendClient,
                        ActorPopularityClient actorClient, RateLimiter rateLimiter, MetricsService metrics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scoringEngine = Objects.requireNonNull(scoringEngine, "scoringEngine must not be null");
        this.trendClient = trendClient;
        this.actorClient = actorClient;
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Fills the Google trend score, then the actor trend score, each only when missing.
     *
     * @return the fields written
     */
    public List<MovieField> fillMissingTrends(long movieId) {
        List<MovieField> filled = new ArrayList<>();
        Movie movie = requireMovie(movieId);

        if (trendClient != null && movie.isMissing(MovieField.GOOGLE_TREND_SCORE)) {
            OptionalInt raw = trendClient.fetch7DayAverage(movie.getTitle());
            if (raw.isPresent()) {
                double fair = scoringEngine.googleTrendFair(raw.getAsInt(), movie.getOriginCountry());
                write(movieId, MovieField.GOOGLE_TREND_SCORE, fair, filled);
                log.debug("trend.google.filled movieId={} raw={} fair={}", movieId, raw.getAsInt(), fair);
            }
        }

        if (actorClient != null && store.isFieldMissing(movieId, MovieField.ACTOR_TREND_SCORE)) {
            rateLimiter.acquire(ThrottleKeys.ACTORS);
            OptionalDouble popularity = actorClient.fetchPopularity(movie.getTitle());
            if (popularity.isPresent()) {
                Double googleTrend = requireMovie(movieId).getGoogleTrendScore();
                double fair = scoringEngine.actorTrendFair(popularity.getAsDouble(),
                        googleTrend != null ? googleTrend : 0.0, movie.getOriginCountry());
                write(movieId, MovieField.ACTOR_TREND_SCORE, fair, filled);
                log.debug("trend.actor.filled movieId={} popularity={} fair={}",
                        movieId, popularity.getAsDouble(), fair);
            }
        }
        return filled;
    }

    /**
     * Recomputes the combined score from the stored rating samples and writes it. Leaves the
     * stored score untouched when the movie has no samples.
     */
    public OptionalDouble recalculateCombinedScore(long movieId) {
        Movie movie = requireMovie(movieId);
        OptionalDouble score = scoringEngine.combinedScore(movie.getOriginCountry(), store.ratings(movieId));
        if (score.isPresent()) {
            store.updateField(movieId, MovieField.COMBINED_SCORE, score.getAsDouble());
            log.debug("score.combined.updated movieId={} score={}", movieId, score.getAsDouble());
        } else {
            log.debug("score.combined.skipped movieId={} reason=no_samples", movieId);
        }
        return score;
    }

    private void write(long movieId, MovieField field, double value, List<MovieField> filled) {
        store.updateField(movieId, field, value);
        filled.add(field);
        metrics.incrementFieldFilled(field);
    }

    private Movie requireMovie(long movieId) {
        return store.findById(movieId).orElseThrow(() -> new MovieNotFoundException(movieId));
    }
}
