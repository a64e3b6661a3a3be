package com.movie.night.throttle;

import com.movie.night.metrics.MetricsService;
import com.movie.night.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Enforces a minimum gap, plus random jitter, between consecutive calls under the same key.
 * The gap is measured from the end of the previous acquisition. Keys are paced independently;
 * callers on the same key are serialized.
 */
public class MinIntervalRateLimiter implements RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(MinIntervalRateLimiter.class);

    private final ThrottleConfig config;
    private final TimeSource timeSource;
    private final DoubleSupplier jitterSource;
    private final MetricsService metricsService;
    private final ConcurrentMap<String, KeyState> states = new ConcurrentHashMap<>();

    public MinIntervalRateLimiter(ThrottleConfig config) {
        this(config, TimeSource.system(), () -> ThreadLocalRandom.current().nextDouble(), new NoOpMetricsService());
    }

    /**
     * @param jitterSource supplies values in {@code [0, 1)} that scale {@code maxJitter}
     */
    public MinIntervalRateLimiter(ThrottleConfig config, TimeSource timeSource, DoubleSupplier jitterSource,
                                  MetricsService metricsService) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
        this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService must not be null");
    }

    @Override
    public void acquire(String key) {
        KeyState state = states.computeIfAbsent(key, k -> new KeyState());
        synchronized (state) {
            if (state.hasHit) {
                long jitterNanos = (long) (config.maxJitter().toNanos() * jitterSource.getAsDouble());
                long requiredNanos = config.minInterval().toNanos() + jitterNanos;
                long elapsedNanos = timeSource.nanoTime() - state.lastHitNanos;
                long waitNanos = requiredNanos - elapsedNanos;
                if (waitNanos > 0) {
                    Duration wait = Duration.ofNanos(waitNanos);
                    log.trace("throttle.waiting key={} waitMs={}", key, wait.toMillis());
                    try {
                        timeSource.sleep(wait);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new ThrottleInterruptedException("Interrupted while throttling key: " + key, e);
                    }
                    metricsService.recordThrottleWait(key, wait);
                }
            }
            state.lastHitNanos = timeSource.nanoTime();
            state.hasHit = true;
        }
    }

    public ThrottleConfig getConfig() {
        return config;
    }

    private static final class KeyState {
        private long lastHitNanos;
        private boolean hasHit;
    }
}
