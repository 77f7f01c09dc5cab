package com.ormcost.util;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Clock used by the engine. {@link #nanoTime()} times round-trips and units of work;
 * {@link #now()} stamps reports.
 *
 * <p>A read may fail with {@link ClockUnavailableException}. Instrumentation never lets that
 * reach the observed operation: it reads through {@link #tryNanoTime()} and {@link #tryNow()},
 * and records the affected timing as unknown.
 */
public sealed interface TimeSource permits SystemTimeSource, MockTimeSource {

    /**
     * Monotonic time in nanoseconds; only differences are meaningful.
     *
     * @throws ClockUnavailableException if the clock cannot be read
     */
    long nanoTime();

    /**
     * Wall-clock instant.
     *
     * @throws ClockUnavailableException if the clock cannot be read
     */
    Instant now();

    /**
     * Reads {@link #nanoTime()}, or returns empty when the clock is unavailable.
     */
    default OptionalLong tryNanoTime() {
        try {
            return OptionalLong.of(nanoTime());
        } catch (ClockUnavailableException e) {
            return OptionalLong.empty();
        }
    }

    /**
     * Reads {@link #now()}, or returns empty when the clock is unavailable.
     */
    default Optional<Instant> tryNow() {
        try {
            return Optional.of(now());
        } catch (ClockUnavailableException e) {
            return Optional.empty();
        }
    }

    /**
     * Time elapsed since {@code startNanos}; empty if the start is unknown or the clock
     * cannot be read now.
     */
    default Optional<Duration> elapsedSince(OptionalLong startNanos) {
        if (startNanos.isEmpty()) {
            return Optional.empty();
        }
        OptionalLong endNanos = tryNanoTime();
        if (endNanos.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(endNanos.getAsLong() - startNanos.getAsLong()));
    }

    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }

    /**
     * Mock clock starting at the given nano time and the current instant.
     */
    static MockTimeSource mock(long initialNanos) {
        return new MockTimeSource(initialNanos, Instant.now());
    }

    /**
     * Mock clock starting at nano time zero and the given instant.
     */
    static MockTimeSource mockAt(Instant instant) {
        return new MockTimeSource(0L, instant);
    }
}
