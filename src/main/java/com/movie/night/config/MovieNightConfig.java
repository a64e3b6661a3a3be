package com.movie.night.config;

import com.movie.night.enrichment.ThrottleKeys;
import com.movie.night.identity.MatchOptions;
import com.movie.night.scoring.ScoringOptions;
import com.movie.night.throttle.RateLimiter;
import com.movie.night.throttle.RoutingRateLimiter;
import com.movie.night.throttle.ThrottleConfig;
import com.movie.night.trailer.CacheConfig;
import com.movie.night.trailer.ResolverOptions;
import com.movie.night.trailer.TrailerResolver;
import com.movie.night.trailer.TrailerSource;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * All tunables of the library in one immutable object, passed explicitly to whatever needs it.
 *
 * <p>Can be built in code or read through MicroProfile Config. The library ships its defaults
 * in {@code META-INF/microprofile-config.properties}; system properties, environment variables
 * or an application's own config sources override them. Every property is optional and falls
 * back to the default shown:</p>
 * <pre>
 * movie-night.identity.threshold=0.80
 * movie-night.identity.runtime-tolerance-minutes=10
 * movie-night.identity.year-tolerance=1
 * movie-night.trailer.fuzzy-local-lookup=true
 * movie-night.trailer.fuzzy-cutoff=0.80
 * movie-night.trailer.secondary-max-retries=3
 * movie-night.cache.enabled=true
 * movie-night.cache.max-size=2000
 * movie-night.cache.ttl-seconds=86400
 * movie-night.throttle.enabled=true
 * movie-night.throttle.jitter-ms=300
 * movie-night.throttle.provider-interval-ms=400
 * movie-night.throttle.secondary-interval-ms=600
 * movie-night.throttle.trends-interval-ms=1200
 * movie-night.throttle.video-interval-ms=1000
 * movie-night.scoring.penalty.IMDB=1.5
 * movie-night.scoring.bonus-scale=5.0
 * movie-night.credentials.metadata-provider-key=
 * movie-night.credentials.secondary-provider-key=
 * movie-night.credentials.video-search-key=
 * </pre>
 */
public final class MovieNightConfig {
    private static final Logger log = LoggerFactory.getLogger(MovieNightConfig.class);

    static final String PREFIX = "movie-night.";
    static final String PENALTY_PREFIX = PREFIX + "scoring.penalty.";

    private static final Duration DEFAULT_VIDEO_INTERVAL = Duration.ofMillis(1000);

    private final MatchOptions matchOptions;
    private final ResolverOptions resolverOptions;
    private final CacheConfig trailerCache;
    private final ScoringOptions scoringOptions;
    private final ThrottleConfig providerThrottle;
    private final ThrottleConfig secondaryThrottle;
    private final ThrottleConfig trendThrottle;
    private final ThrottleConfig videoThrottle;
    private final ProviderCredentials credentials;

    private MovieNightConfig(Builder builder) {
        this.matchOptions = builder.matchOptions;
        this.resolverOptions = builder.resolverOptions;
        this.trailerCache = builder.trailerCache;
        this.scoringOptions = builder.scoringOptions;
        this.providerThrottle = builder.providerThrottle;
        this.secondaryThrottle = builder.secondaryThrottle;
        this.trendThrottle = builder.trendThrottle;
        this.videoThrottle = builder.videoThrottle;
        this.credentials = builder.credentials;
    }

    public static MovieNightConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the {@code movie-night.*} properties from the MicroProfile Config of the calling
     * class loader.
     *
     * @throws ConfigurationException if a property holds an invalid value
     */
    public static MovieNightConfig fromClasspath() {
        return fromConfig(ConfigProvider.getConfig());
    }

    /**
     * @throws ConfigurationException if a property holds an invalid value
     */
    public static MovieNightConfig fromConfig(Config source) {
        Objects.requireNonNull(source, "config must not be null");
        ConfigReader reader = new ConfigReader(source);
        try {
            MatchOptions match = MatchOptions.builder()
                    .threshold(reader.get("identity.threshold", Double.class, 0.80))
                    .runtimeToleranceMinutes(reader.get("identity.runtime-tolerance-minutes", Integer.class, 10))
                    .yearTolerance(reader.get("identity.year-tolerance", Integer.class, 1))
                    .build();

            ResolverOptions resolver = ResolverOptions.builder()
                    .fuzzyLocalLookup(reader.get("trailer.fuzzy-local-lookup", Boolean.class, true))
                    .fuzzyCutoff(reader.get("trailer.fuzzy-cutoff", Double.class, 0.80))
                    .secondaryMaxRetries(reader.get("trailer.secondary-max-retries", Integer.class, 3))
                    .build();

            CacheConfig defaultCache = CacheConfig.defaults();
            CacheConfig cache = new CacheConfig(
                    reader.get("cache.max-size", Integer.class, defaultCache.maxSize()),
                    reader.get("cache.ttl-seconds", Integer.class, defaultCache.ttlSeconds()),
                    reader.get("cache.enabled", Boolean.class, true));

            ScoringOptions.Builder scoring = ScoringOptions.builder()
                    .bonusScale(reader.get("scoring.bonus-scale", Double.class, 5.0));
            for (String name : source.getPropertyNames()) {
                if (name.startsWith(PENALTY_PREFIX) && name.length() > PENALTY_PREFIX.length()) {
                    String key = name.substring(PREFIX.length());
                    scoring.sourcePenalty(name.substring(PENALTY_PREFIX.length()),
                            reader.get(key, Double.class, 1.0));
                }
            }

            boolean throttled = reader.get("throttle.enabled", Boolean.class, true);
            Duration jitter = Duration.ofMillis(reader.get("throttle.jitter-ms", Integer.class, 300));

            MovieNightConfig config = builder()
                    .matchOptions(match)
                    .resolverOptions(resolver)
                    .trailerCache(cache)
                    .scoringOptions(scoring.build())
                    .providerThrottle(throttle(reader, "provider", 400, jitter, throttled))
                    .secondaryThrottle(throttle(reader, "secondary", 600, jitter, throttled))
                    .trendThrottle(throttle(reader, "trends", 1200, jitter, throttled))
                    .videoThrottle(throttle(reader, "video", (int) DEFAULT_VIDEO_INTERVAL.toMillis(), jitter, throttled))
                    .credentials(new ProviderCredentials(
                            reader.get("credentials.metadata-provider-key", String.class, null),
                            reader.get("credentials.secondary-provider-key", String.class, null),
                            reader.get("credentials.video-search-key", String.class, null)))
                    .build();
            log.debug("config.loaded config={}", config);
            return config;
        } catch (ConfigurationException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static ThrottleConfig throttle(ConfigReader reader, String service, int defaultMillis,
                                           Duration jitter, boolean enabled) {
        if (!enabled) {
            return ThrottleConfig.disabled();
        }
        Duration interval = Duration.ofMillis(
                reader.get("throttle." + service + "-interval-ms", Integer.class, defaultMillis));
        return new ThrottleConfig(interval, jitter, true);
    }

    /**
     * One limiter pacing every service at its configured rate: metadata provider calls
     * (enrichment and trailer listing), secondary provider and scraper calls, trend and actor
     * calls, and video searches.
     */
    public RateLimiter rateLimiter() {
        return RoutingRateLimiter.builder()
                .route(providerThrottle.toRateLimiter(),
                        ThrottleKeys.PRIMARY_PROVIDER, TrailerResolver.rateLimitKey(TrailerSource.PROVIDER))
                .route(secondaryThrottle.toRateLimiter(),
                        ThrottleKeys.SECONDARY_PROVIDER, ThrottleKeys.SCRAPER)
                .route(trendThrottle.toRateLimiter(), ThrottleKeys.TRENDS, ThrottleKeys.ACTORS)
                .route(videoThrottle.toRateLimiter(),
                        TrailerResolver.rateLimitKey(TrailerSource.SECONDARY_EXACT),
                        TrailerResolver.rateLimitKey(TrailerSource.SECONDARY_FUZZY))
                .build();
    }

    public MatchOptions getMatchOptions() {
        return matchOptions;
    }

    public ResolverOptions getResolverOptions() {
        return resolverOptions;
    }

    public CacheConfig getTrailerCache() {
        return trailerCache;
    }

    public ScoringOptions getScoringOptions() {
        return scoringOptions;
    }

    public ThrottleConfig getProviderThrottle() {
        return providerThrottle;
    }

    public ThrottleConfig getSecondaryThrottle() {
        return secondaryThrottle;
    }

    public ThrottleConfig getTrendThrottle() {
        return trendThrottle;
    }

    public ThrottleConfig getVideoThrottle() {
        return videoThrottle;
    }

    public ProviderCredentials getCredentials() {
        return credentials;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchOptions matchOptions = MatchOptions.defaults();
        private ResolverOptions resolverOptions = ResolverOptions.defaults();
        private CacheConfig trailerCache = CacheConfig.defaults();
        private ScoringOptions scoringOptions = ScoringOptions.defaults();
        private ThrottleConfig providerThrottle = ThrottleConfig.metadataProvider();
        private ThrottleConfig secondaryThrottle = ThrottleConfig.secondaryProvider();
        private ThrottleConfig trendThrottle = ThrottleConfig.trends();
        private ThrottleConfig videoThrottle = ThrottleConfig.of(DEFAULT_VIDEO_INTERVAL);
        private ProviderCredentials credentials = ProviderCredentials.none();

        public Builder matchOptions(MatchOptions matchOptions) {
            this.matchOptions = Objects.requireNonNull(matchOptions, "matchOptions must not be null");
            return this;
        }

        public Builder resolverOptions(ResolverOptions resolverOptions) {
            this.resolverOptions = Objects.requireNonNull(resolverOptions, "resolverOptions must not be null");
            return this;
        }

        public Builder trailerCache(CacheConfig trailerCache) {
            this.trailerCache = Objects.requireNonNull(trailerCache, "trailerCache must not be null");
            return this;
        }

        public Builder scoringOptions(ScoringOptions scoringOptions) {
            this.scoringOptions = Objects.requireNonNull(scoringOptions, "scoringOptions must not be null");
            return this;
        }

        public Builder providerThrottle(ThrottleConfig providerThrottle) {
            this.providerThrottle = Objects.requireNonNull(providerThrottle, "providerThrottle must not be null");
            return this;
        }

        public Builder secondaryThrottle(ThrottleConfig secondaryThrottle) {
            this.secondaryThrottle = Objects.requireNonNull(secondaryThrottle, "secondaryThrottle must not be null");
            return this;
        }

        public Builder trendThrottle(ThrottleConfig trendThrottle) {
            this.trendThrottle = Objects.requireNonNull(trendThrottle, "trendThrottle must not be null");
            return this;
        }

        public Builder videoThrottle(ThrottleConfig videoThrottle) {
            this.videoThrottle = Objects.requireNonNull(videoThrottle, "videoThrottle must not be null");
            return this;
        }

        /**
         * Disables pacing for every service. Intended for tests.
         */
        public Builder noThrottling() {
            this.providerThrottle = ThrottleConfig.disabled();
            this.secondaryThrottle = ThrottleConfig.disabled();
            this.trendThrottle = ThrottleConfig.disabled();
            this.videoThrottle = ThrottleConfig.disabled();
            return this;
        }

        public Builder credentials(ProviderCredentials credentials) {
            this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
            return this;
        }

        public MovieNightConfig build() {
            return new MovieNightConfig(this);
        }
    }

    @Override
    public String toString() {
        return "MovieNightConfig{" +
                "matchOptions=" + matchOptions +
                ", resolverOptions=" + resolverOptions +
                ", trailerCache=" + trailerCache +
                ", scoringOptions=" + scoringOptions +
                ", providerThrottle=" + providerThrottle +
                ", secondaryThrottle=" + secondaryThrottle +
                ", trendThrottle=" + trendThrottle +
                ", videoThrottle=" + videoThrottle +
                ", credentials=" + credentials +
                '}';
    }

    /**
     * Typed access to {@code movie-night.*} properties. Conversion failures name the key.
     */
    static final class ConfigReader {
        private final Config config;

        ConfigReader(Config config) {
            this.config = config;
        }

        <T> T get(String key, Class<T> type, T defaultValue) {
            try {
                return config.getOptionalValue(PREFIX + key, type).orElse(defaultValue);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(
                        PREFIX + key + " is not a valid " + type.getSimpleName() + ": " + e.getMessage(), e);
            }
        }
    }
}
