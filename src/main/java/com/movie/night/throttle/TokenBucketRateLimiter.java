package com.movie.night.throttle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-key token bucket. Allows bursts up to {@code burstSize} calls and then paces callers
 * at {@code tokensPerSecond}. {@link #tryAcquire(String)} never blocks; {@link #acquire(String)}
 * sleeps until a token is available.
 */
public class TokenBucketRateLimiter implements RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final int burstSize;
    private final double tokensPerSecond;
    private final TimeSource timeSource;
    private final ConcurrentHashMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    public TokenBucketRateLimiter(int burstSize, double tokensPerSecond) {
        this(burstSize, tokensPerSecond, TimeSource.system());
    }

    public TokenBucketRateLimiter(int burstSize, double tokensPerSecond, TimeSource timeSource) {
        if (burstSize <= 0) {
            throw new IllegalArgumentException("burstSize must be > 0");
        }
        if (tokensPerSecond <= 0) {
            throw new IllegalArgumentException("tokensPerSecond must be > 0");
        }
        this.burstSize = burstSize;
        this.tokensPerSecond = tokensPerSecond;
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
    }

    @Override
    public void acquire(String key) {
        TokenBucket bucket = bucket(key);
        while (!bucket.tryConsume()) {
            Duration wait = bucket.timeUntilNextToken();
            log.trace("throttle.waiting key={} waitMs={}", key, wait.toMillis());
            try {
                timeSource.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ThrottleInterruptedException("Interrupted while throttling key: " + key, e);
            }
        }
    }

    /**
     * Consumes a token if one is available.
     *
     * @return false when the bucket for {@code key} is exhausted
     */
    public boolean tryAcquire(String key) {
        return bucket(key).tryConsume();
    }

    // Visible for testing
    long availableTokens(String key) {
        return bucket(key).availableTokens();
    }

    private TokenBucket bucket(String key) {
        return buckets.computeIfAbsent(key, k -> new TokenBucket(burstSize, tokensPerSecond, timeSource));
    }

    /**
     * Lock-free bucket; tokens are stored as fixed-point thousandths.
     */
    static final class TokenBucket {
        private final int maxTokens;
        private final double refillPerNano;
        private final TimeSource timeSource;
        private final AtomicLong milliTokens;
        private final AtomicLong lastRefillNanos;

        TokenBucket(int maxTokens, double tokensPerSecond, TimeSource timeSource) {
            this.maxTokens = maxTokens;
            this.refillPerNano = tokensPerSecond / 1_000_000_000.0;
            this.timeSource = timeSource;
            this.milliTokens = new AtomicLong((long) maxTokens * 1000);
            this.lastRefillNanos = new AtomicLong(timeSource.nanoTime());
        }

        boolean tryConsume() {
            refill();
            while (true) {
                long current = milliTokens.get();
                if (current < 1000) {
                    return false;
                }
                if (milliTokens.compareAndSet(current, current - 1000)) {
                    return true;
                }
            }
        }

        Duration timeUntilNextToken() {
            long missing = 1000 - milliTokens.get();
            if (missing <= 0) {
                return Duration.ZERO;
            }
            long nanos = (long) Math.ceil(missing / (refillPerNano * 1000));
            return Duration.ofNanos(Math.max(nanos, 1));
        }

        long availableTokens() {
            refill();
            return milliTokens.get() / 1000;
        }

        private void refill() {
            long now = timeSource.nanoTime();
            long last = lastRefillNanos.get();
            long elapsed = now - last;
            if (elapsed <= 0) {
                return;
            }
            long added = (long) (elapsed * refillPerNano * 1000);
            if (added <= 0) {
                return;
            }
            if (lastRefillNanos.compareAndSet(last, now)) {
                milliTokens.updateAndGet(current -> Math.min((long) maxTokens * 1000, current + added));
            }
        }
    }
}
