package com.ormcost.util;

import java.time.Clock;
import java.time.Instant;

/**
 * Production clock: {@link System#nanoTime()} for durations, the UTC system clock for instants.
 * Reads never fail.
 */
public final class SystemTimeSource implements TimeSource {

    static final SystemTimeSource INSTANCE = new SystemTimeSource(Clock.systemUTC());

    private final Clock wallClock;

    private SystemTimeSource(Clock wallClock) {
        this.wallClock = wallClock;
    }

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    @Override
    public Instant now() {
        return wallClock.instant();
    }

    @Override
    public String toString() {
        return "SystemTimeSource[" + wallClock.getZone() + "]";
    }
}
