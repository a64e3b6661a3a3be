package com.movie.night.trailer;

import com.movie.night.client.MetadataProviderClient;
import com.movie.night.client.RateLimitExceededException;
import com.movie.night.client.VideoListing;
import com.movie.night.client.VideoSearchClient;
import com.movie.night.logging.LogContext;
import com.movie.night.metrics.MetricsService;
import com.movie.night.metrics.NoOpMetricsService;
import com.movie.night.model.Movie;
import com.movie.night.similarity.TitleSimilarity;
import com.movie.night.store.MovieStore;
import com.movie.night.throttle.NoOpRateLimiter;
import com.movie.night.throttle.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Finds a trailer URL for a title by walking a fixed cascade of tiers, cheapest and most
 * trusted first, and returning the first valid hit:
 * <ol>
 *   <li>cache of earlier successful lookups</li>
 *   <li>the store, by exact title or alias, then by close title</li>
 *   <li>the metadata provider's video listing for the exact title</li>
 *   <li>an exact video search on the provider's canonical slug</li>
 *   <li>a broad video search on the title</li>
 * </ol>
 * Network tiers are paced by the injected {@link RateLimiter} under {@code trailer.<tag>}
 * keys. A failing network tier, rate limits included, is logged and skipped.
 */
public class TrailerResolver {
    private static final Logger log = LoggerFactory.getLogger(TrailerResolver.class);

    static final String RATE_LIMIT_KEY_PREFIX = "trailer.";

    private final MovieStore store;
    private final MetadataProviderClient provider;
    private final VideoSearchClient videoSearch;
    private final RateLimiter rateLimiter;
    private final TrailerCache cache;
    private final ResolverOptions options;
    private final MetricsService metrics;
    private final TitleSimilarity titleSimilarity = new TitleSimilarity();

    public TrailerResolver(MovieStore store, MetadataProviderClient provider, VideoSearchClient videoSearch) {
        this(store, provider, videoSearch, new NoOpRateLimiter(), new NoOpTrailerCache(),
                ResolverOptions.defaults(), new NoOpMetricsService());
    }

    public TrailerResolver(MovieStore store, MetadataProviderClient provider, VideoSearchClient videoSearch,
                           RateLimiter rateLimiter, TrailerCache cache, ResolverOptions options,
                           MetricsService metrics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.videoSearch = Objects.requireNonNull(videoSearch, "videoSearch must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Locates a trailer for {@code title}. Never returns null; a miss is
     * {@link TrailerResolution#notFound()}.
     *
     * @throws com.movie.night.throttle.ThrottleInterruptedException if interrupted while paced
     */
    public TrailerResolution locateTrailer(String title) {
        Objects.requireNonNull(title, "title must not be null");
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forTrailer(title)) {
            Optional<TrailerResolution> cached = cache.get(title);
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                log.debug("trailer.cache.hit title='{}' source={}", title, cached.get().sourceTag());
                return cached.get();
            }
            metrics.recordCacheMiss();

            TrailerResolution resolution = resolve(title);
            cache.put(title, resolution);

            metrics.recordTrailerResolution(resolution.sourceTag(), Duration.ofNanos(System.nanoTime() - start));
            log.info("trailer.resolved title='{}' source={} confidence={}",
                    title, resolution.sourceTag(), resolution.confidence());
            return resolution;
        }
    }

    private TrailerResolution resolve(String title) {
        Optional<String> local = localExact(title);
        if (local.isPresent()) {
            return TrailerResolution.of(local.get(), TrailerSource.DB);
        }
        if (options.isFuzzyLocalLookup()) {
            Optional<String> fuzzy = localFuzzy(title);
            if (fuzzy.isPresent()) {
                return TrailerResolution.of(fuzzy.get(), TrailerSource.DB_FUZZY);
            }
        }

        Optional<VideoListing> listing = callTier(TrailerSource.PROVIDER, () -> provider.fetchVideosExact(title));
        if (listing.isPresent()) {
            Optional<String> providerUrl = listing.get().firstYouTubeTrailerKey()
                    .map(VideoUrls::watchUrl)
                    .filter(VideoUrls::isValid);
            if (providerUrl.isPresent()) {
                return TrailerResolution.of(providerUrl.get(), TrailerSource.PROVIDER);
            }
            if (listing.get().hasSlug()) {
                String query = listing.get().slug() + " trailer";
                Optional<String> slugHit = callTier(TrailerSource.SECONDARY_EXACT,
                        () -> videoSearch.searchExact(query)).flatMap(VideoUrls::normalize);
                if (slugHit.isPresent()) {
                    return TrailerResolution.of(slugHit.get(), TrailerSource.SECONDARY_EXACT);
                }
            }
        }

        String query = title + " trailer";
        Optional<String> broadHit = callTier(TrailerSource.SECONDARY_FUZZY,
                () -> videoSearch.searchFirstMatch(query, false, options.getSecondaryMaxRetries()))
                .flatMap(VideoUrls::normalize);
        return broadHit
                .map(url -> TrailerResolution.of(url, TrailerSource.SECONDARY_FUZZY))
                .orElseGet(TrailerResolution::notFound);
    }

    private Optional<String> localExact(String title) {
        return store.findIdByTitle(title)
                .flatMap(this::storedTrailer);
    }

    /**
     * Closest stored title at or above the cutoff that has a valid trailer.
     */
    private Optional<String> localFuzzy(String title) {
        List<Map.Entry<Long, Double>> candidates = new ArrayList<>();
        for (Map.Entry<Long, String> entry : store.titlesById().entrySet()) {
            double score = titleSimilarity.compute(title, entry.getValue());
            if (score >= options.getFuzzyCutoff()) {
                candidates.add(Map.entry(entry.getKey(), score));
            }
        }
        candidates.sort(Map.Entry.<Long, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));

        for (Map.Entry<Long, Double> candidate : candidates) {
            Optional<String> url = storedTrailer(candidate.getKey());
            if (url.isPresent()) {
                log.debug("trailer.local.fuzzy title='{}' movieId={} score={}",
                        title, candidate.getKey(), candidate.getValue());
                return url;
            }
        }
        return Optional.empty();
    }

    private Optional<String> storedTrailer(long movieId) {
        return store.findById(movieId)
                .map(Movie::getTrailerUrl)
                .filter(VideoUrls::isValid);
    }

    /**
     * Key under which a network tier acquires the rate limiter, e.g. {@code trailer.provider}.
     */
    public static String rateLimitKey(TrailerSource tier) {
        return RATE_LIMIT_KEY_PREFIX + tier.getTag();
    }

    private <T> Optional<T> callTier(TrailerSource tier, Supplier<Optional<T>> call) {
        rateLimiter.acquire(rateLimitKey(tier));
        try {
            Optional<T> result = call.get();
            return result != null ? result : Optional.empty();
        } catch (RateLimitExceededException e) {
            metrics.incrementTrailerTierFailure(tier.getTag());
            log.warn("trailer.tier.rateLimited tier={} provider={}", tier.getTag(), e.getProvider());
            return Optional.empty();
        } catch (RuntimeException e) {
            metrics.incrementTrailerTierFailure(tier.getTag());
            log.warn("trailer.tier.failed tier={} error={}", tier.getTag(), e.getMessage());
            log.debug("trailer.tier.failed stack", e);
            return Optional.empty();
        }
    }
}
