package com.movie.night.throttle;

import java.time.Duration;

/**
 * Monotonic clock plus sleep, injectable so tests can simulate the passage of time.
 */
public interface TimeSource {

    long nanoTime();

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Wall-clock implementation backed by {@link System#nanoTime()} and {@link Thread#sleep(long, int)}.
     */
    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }

    final class SystemTimeSource implements TimeSource {
        private static final SystemTimeSource INSTANCE = new SystemTimeSource();

        private SystemTimeSource() {
        }

        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            long nanos = duration.toNanos();
            if (nanos > 0) {
                Thread.sleep(nanos / 1_000_000, (int) (nanos % 1_000_000));
            }
        }
    }
}
