package com.ormcost.util;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Round-trip durations for tests. Fixtures speak in microseconds; driver events carry
 * elapsed time in nanoseconds.
 */
public final class TestDurations {

    private TestDurations() {}

    public static Duration micros(long micros) {
        return Duration.of(micros, ChronoUnit.MICROS);
    }

    public static Duration millis(long millis) {
        return Duration.of(millis, ChronoUnit.MILLIS);
    }

    /**
     * Elapsed time as a driver command event reports it.
     */
    public static long driverNanos(Duration elapsed) {
        return elapsed.toNanos();
    }
}
