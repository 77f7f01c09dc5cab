package com.ormcost.engine;

import com.ormcost.report.Report;

import java.util.Objects;

/**
 * Result of work run inside a unit of work, together with the unit's report.
 */
public record Observed<T>(T result, Report report) {

    public Observed {
        Objects.requireNonNull(report, "report must not be null");
    }
}
