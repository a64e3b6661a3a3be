package com.movie.night.throttle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Manual clock: sleeping advances time instantly and is recorded.
 */
class FakeTimeSource implements TimeSource {

    private long nanos = 1_000_000_000L;
    private final List<Duration> sleeps = new ArrayList<>();

    @Override
    public long nanoTime() {
        return nanos;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        nanos += duration.toNanos();
    }

    void advance(Duration duration) {
        nanos += duration.toNanos();
    }

    List<Duration> sleeps() {
        return sleeps;
    }
}
