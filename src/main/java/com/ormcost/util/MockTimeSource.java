package com.ormcost.util;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mock time source for testing.
 * Allows controlled time progression and simulating a clock that cannot be read.
 */
public final class MockTimeSource implements TimeSource {
    private final AtomicLong nanoTime;
    private final AtomicReference<Instant> instant;
    private final AtomicBoolean unavailable = new AtomicBoolean(false);

    public MockTimeSource(long initialNanos, Instant initialInstant) {
        this.nanoTime = new AtomicLong(initialNanos);
        this.instant = new AtomicReference<>(initialInstant);
    }

    @Override
    public long nanoTime() {
        checkAvailable();
        return nanoTime.get();
    }

    @Override
    public Instant now() {
        checkAvailable();
        return instant.get();
    }

    /**
     * Advances time by the specified duration.
     */
    public void advance(Duration duration) {
        nanoTime.addAndGet(duration.toNanos());
        instant.updateAndGet(i -> i.plus(duration));
    }

    /**
     * While unavailable, every read throws {@link ClockUnavailableException}.
     */
    public void setUnavailable(boolean unavailable) {
        this.unavailable.set(unavailable);
    }

    private void checkAvailable() {
        if (unavailable.get()) {
            throw new ClockUnavailableException("Mock clock set unavailable");
        }
    }
}
