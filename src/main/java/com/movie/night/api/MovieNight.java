package com.movie.night.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.movie.night.client.ActorPopularityClient;
import com.movie.night.client.DailyCachingTrendClient;
import com.movie.night.client.DetailScraper;
import com.movie.night.client.MetadataProviderClient;
import com.movie.night.client.SecondaryMetadataClient;
import com.movie.night.client.TrendClient;
import com.movie.night.client.VideoSearchClient;
import com.movie.night.config.MovieNightConfig;
import com.movie.night.enrichment.BatchEnrichmentRunner;
import com.movie.night.enrichment.BatchResult;
import com.movie.night.enrichment.EnrichmentOrchestrator;
import com.movie.night.enrichment.EnrichmentReport;
import com.movie.night.enrichment.ProgressCallback;
import com.movie.night.enrichment.ScoreRefreshService;
import com.movie.night.enrichment.ScoreUpdater;
import com.movie.night.enrichment.ThrottleKeys;
import com.movie.night.identity.HashingTitleEmbedder;
import com.movie.night.identity.IdentityMatch;
import com.movie.night.identity.IdentityMatcher;
import com.movie.night.identity.MetadataSource;
import com.movie.night.identity.MovieFingerprint;
import com.movie.night.identity.NormalizerRegistry;
import com.movie.night.identity.TitleEmbedder;
import com.movie.night.metrics.MetricsService;
import com.movie.night.metrics.NoOpMetricsService;
import com.movie.night.model.Movie;
import com.movie.night.reference.CertificationSchemes;
import com.movie.night.scoring.BaselineLoader;
import com.movie.night.scoring.Baselines;
import com.movie.night.scoring.FairnessScoringEngine;
import com.movie.night.similarity.GroupSimilarityEngine;
import com.movie.night.similarity.PairSimilarity;
import com.movie.night.store.BatchJob;
import com.movie.night.store.InMemoryKeyValueStore;
import com.movie.night.store.InMemoryMovieStore;
import com.movie.night.store.InMemoryTrendCache;
import com.movie.night.store.KeyValueCheckpointStore;
import com.movie.night.store.KeyValueStore;
import com.movie.night.store.MovieStore;
import com.movie.night.store.TrendCache;
import com.movie.night.throttle.RateLimiter;
import com.movie.night.trailer.TrailerCache;
import com.movie.night.trailer.TrailerResolution;
import com.movie.night.trailer.TrailerResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Main entry point of the library. Wires the identity matcher, trailer resolver, enrichment
 * orchestrator, fairness scoring and similarity engines over one store and one set of clients.
 *
 * <pre>
 * MovieNight movieNight = MovieNight.builder()
 *     .config(MovieNightConfig.fromClasspath())
 *     .metadataProvider(tmdb)
 *     .secondaryProvider(omdb)
 *     .videoSearch(youtube)
 *     .build();
 *
 * long id = movieNight.getStore().addMovie(Movie.builder().title("Up"));
 * EnrichmentReport report = movieNight.enrichMovie(id);
 * BatchResult result = movieNight.runBatch(BatchJob.TRAILER_REPAIR, false, ProgressCallback.NOOP);
 * </pre>
 */
public class MovieNight {
    private static final Logger log = LoggerFactory.getLogger(MovieNight.class);

    private final MovieNightConfig config;
    private final MovieStore store;
    private final NormalizerRegistry normalizers;
    private final IdentityMatcher identityMatcher;
    private final TrailerResolver trailerResolver;
    private final TrailerCache trailerCache;
    private final FairnessScoringEngine scoringEngine;
    private final EnrichmentOrchestrator orchestrator;
    private final ScoreRefreshService scoreRefreshService;
    private final BatchEnrichmentRunner batchRunner;
    private final GroupSimilarityEngine similarityEngine;

    private MovieNight(Builder builder) {
        this.config = builder.config;
        this.store = builder.store != null ? builder.store : new InMemoryMovieStore();
        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        RateLimiter rateLimiter = builder.rateLimiter != null ? builder.rateLimiter : config.rateLimiter();
        KeyValueStore keyValueStore = builder.keyValueStore != null ? builder.keyValueStore : new InMemoryKeyValueStore();
        TitleEmbedder embedder = builder.titleEmbedder != null ? builder.titleEmbedder : new HashingTitleEmbedder();

        this.normalizers = NormalizerRegistry.withDefaults(embedder);
        this.identityMatcher = new IdentityMatcher(config.getMatchOptions(), metrics);

        this.trailerCache = config.getTrailerCache().toCache();
        this.trailerResolver = new TrailerResolver(store, builder.metadataProvider, builder.videoSearch,
                rateLimiter, trailerCache, config.getResolverOptions(), metrics);

        Baselines baselines = builder.baselines != null ? builder.baselines : BaselineLoader.load(store);
        this.scoringEngine = new FairnessScoringEngine(baselines, config.getScoringOptions(), metrics);

        TrendClient trendClient = builder.trendClient;
        if (trendClient != null) {
            TrendCache trendCache = builder.trendCache != null ? builder.trendCache : new InMemoryTrendCache();
            trendClient = new DailyCachingTrendClient(trendClient, trendCache, rateLimiter, ThrottleKeys.TRENDS);
        }
        ScoreUpdater scoreUpdater = new ScoreUpdater(store, scoringEngine, trendClient,
                builder.actorPopularityClient, rateLimiter, metrics);

        this.orchestrator = EnrichmentOrchestrator.builder()
                .store(store)
                .provider(builder.metadataProvider)
                .secondary(builder.secondaryProvider)
                .scraper(builder.detailScraper)
                .trailerResolver(trailerResolver)
                .scoreUpdater(scoreUpdater)
                .normalizers(normalizers)
                .identityMatcher(identityMatcher)
                .rateLimiter(rateLimiter)
                .metricsService(metrics)
                .build();
        this.scoreRefreshService = new ScoreRefreshService(store, builder.metadataProvider,
                builder.secondaryProvider, scoreUpdater, rateLimiter);
        this.batchRunner = new BatchEnrichmentRunner(store, orchestrator, trailerResolver,
                new KeyValueCheckpointStore(keyValueStore), metrics);

        CertificationSchemes schemes = builder.certificationSchemes != null
                ? builder.certificationSchemes : CertificationSchemes.fromClasspath();
        this.similarityEngine = new GroupSimilarityEngine(store, schemes);

        log.info("movienight.initialized movies={} cache={} scraper={} trends={}",
                store.count(), config.getTrailerCache().enabled(),
                builder.detailScraper != null, builder.trendClient != null);
    }

    // ========== Identity ==========

    public MovieFingerprint fingerprint(MetadataSource source, JsonNode payload) {
        return normalizers.normalize(source, payload);
    }

    public IdentityMatch sameMovie(MovieFingerprint a, MovieFingerprint b) {
        return identityMatcher.sameMovie(a, b);
    }

    // ========== Trailers ==========

    public TrailerResolution locateTrailer(String title) {
        return trailerResolver.locateTrailer(title);
    }

    // ========== Enrichment ==========

    public EnrichmentReport enrichMovie(long movieId) {
        return orchestrator.enrichMovie(movieId);
    }

    public OptionalDouble refreshScoresAndTrends(long movieId) {
        return scoreRefreshService.refreshScoresAndTrends(movieId);
    }

    public int refreshMissingTrends() {
        return scoreRefreshService.refreshMissingTrends();
    }

    public BatchResult runBatch(BatchJob job, boolean full, ProgressCallback callback) {
        return batchRunner.run(job, full, callback);
    }

    // ========== Analytics ==========

    public List<PairSimilarity> similarity(List<Movie> movies) {
        return similarityEngine.calculate(movies);
    }

    public FairnessScoringEngine getScoringEngine() {
        return scoringEngine;
    }

    public MovieStore getStore() {
        return store;
    }

    public TrailerCache getTrailerCache() {
        return trailerCache;
    }

    public MovieNightConfig getConfig() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MovieNightConfig config = MovieNightConfig.defaults();
        private MovieStore store;
        private KeyValueStore keyValueStore;
        private TrendCache trendCache;
        private MetadataProviderClient metadataProvider;
        private SecondaryMetadataClient secondaryProvider;
        private VideoSearchClient videoSearch;
        private DetailScraper detailScraper;
        private TrendClient trendClient;
        private ActorPopularityClient actorPopularityClient;
        private TitleEmbedder titleEmbedder;
        private Baselines baselines;
        private CertificationSchemes certificationSchemes;
        private RateLimiter rateLimiter;
        private MetricsService metricsService;

        public Builder config(MovieNightConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Defaults to an {@link InMemoryMovieStore}.
         */
        public Builder store(MovieStore store) {
            this.store = store;
            return this;
        }

        /**
         * Holds batch checkpoints. Defaults to an {@link InMemoryKeyValueStore}.
         */
        public Builder keyValueStore(KeyValueStore keyValueStore) {
            this.keyValueStore = keyValueStore;
            return this;
        }

        public Builder trendCache(TrendCache trendCache) {
            this.trendCache = trendCache;
            return this;
        }

        public Builder metadataProvider(MetadataProviderClient metadataProvider) {
            this.metadataProvider = metadataProvider;
            return this;
        }

        public Builder secondaryProvider(SecondaryMetadataClient secondaryProvider) {
            this.secondaryProvider = secondaryProvider;
            return this;
        }

        public Builder videoSearch(VideoSearchClient videoSearch) {
            this.videoSearch = videoSearch;
            return this;
        }

        public Builder detailScraper(DetailScraper detailScraper) {
            this.detailScraper = detailScraper;
            return this;
        }

        /**
         * Wrapped in a {@link DailyCachingTrendClient} over the trend cache, which paces cache misses.
         */
        public Builder trendClient(TrendClient trendClient) {
            this.trendClient = trendClient;
            return this;
        }

        public Builder actorPopularityClient(ActorPopularityClient actorPopularityClient) {
            this.actorPopularityClient = actorPopularityClient;
            return this;
        }

        /**
         * Replaces the default {@link HashingTitleEmbedder}, e.g. with a semantic model.
         */
        public Builder titleEmbedder(TitleEmbedder titleEmbedder) {
            this.titleEmbedder = titleEmbedder;
            return this;
        }

        /**
         * Defaults to the bundled population snapshot plus the store's catalogue share.
         */
        public Builder baselines(Baselines baselines) {
            this.baselines = baselines;
            return this;
        }

        public Builder certificationSchemes(CertificationSchemes certificationSchemes) {
            this.certificationSchemes = certificationSchemes;
            return this;
        }

        /**
         * Overrides the limiter built from the configured throttles.
         */
        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public MovieNight build() {
            if (config == null) {
                throw new IllegalStateException("config is required");
            }
            if (metadataProvider == null) {
                throw new IllegalStateException("metadataProvider is required");
            }
            if (secondaryProvider == null) {
                throw new IllegalStateException("secondaryProvider is required");
            }
            if (videoSearch == null) {
                throw new IllegalStateException("videoSearch is required");
            }
            return new MovieNight(this);
        }
    }
}
