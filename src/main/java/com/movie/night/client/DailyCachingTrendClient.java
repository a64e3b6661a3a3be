package com.movie.night.client;

import com.movie.night.store.TrendCache;
import com.movie.night.throttle.NoOpRateLimiter;
import com.movie.night.throttle.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Serves each term from the trend cache at most once per calendar day, calling the delegate
 * only on a miss. Only delegate calls are paced by the rate limiter. Empty answers are not
 * cached.
 */
public class DailyCachingTrendClient implements TrendClient {
    private static final Logger log = LoggerFactory.getLogger(DailyCachingTrendClient.class);

    private final TrendClient delegate;
    private final TrendCache cache;
    private final RateLimiter rateLimiter;
    private final String throttleKey;
    private final Clock clock;

    public DailyCachingTrendClient(TrendClient delegate, TrendCache cache) {
        this(delegate, cache, Clock.systemDefaultZone());
    }

    public DailyCachingTrendClient(TrendClient delegate, TrendCache cache, Clock clock) {
        this(delegate, cache, new NoOpRateLimiter(), "trends", clock);
    }

    public DailyCachingTrendClient(TrendClient delegate, TrendCache cache, RateLimiter rateLimiter,
                                   String throttleKey) {
        this(delegate, cache, rateLimiter, throttleKey, Clock.systemDefaultZone());
    }

    public DailyCachingTrendClient(TrendClient delegate, TrendCache cache, RateLimiter rateLimiter,
                                   String throttleKey, Clock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.throttleKey = Objects.requireNonNull(throttleKey, "throttleKey must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public OptionalInt fetch7DayAverage(String term) {
        LocalDate today = LocalDate.now(clock);
        OptionalInt cached = cache.get(term, today);
        if (cached.isPresent()) {
            log.debug("trend.cache.hit term='{}' day={}", term, today);
            return cached;
        }
        rateLimiter.acquire(throttleKey);
        OptionalInt fetched = delegate.fetch7DayAverage(term);
        if (fetched.isPresent()) {
            cache.put(term, today, fetched.getAsInt());
        }
        return fetched;
    }
}
