package com.ormcost.report;

import com.ormcost.capture.QueryEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only projection of a completed unit of work.
 *
 * @param contextId      execution context the unit of work ran in
 * @param startedAt      wall-clock start, if the clock could be read
 * @param endedAt        wall-clock end, if the clock could be read
 * @param executionTime  elapsed time between begin and end, if measured
 * @param groups         query groups ordered by the start of their first query
 * @param duplicates     normalized statements executed more than once, with their counts
 * @param warnings       scope violations observed while the unit of work was active
 */
public record Report(
        String contextId,
        Optional<Instant> startedAt,
        Optional<Instant> endedAt,
        Optional<Duration> executionTime,
        List<GroupReport> groups,
        Map<String, Integer> duplicates,
        List<ScopeWarning> warnings
) {

    public Report {
        Objects.requireNonNull(contextId, "contextId must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(endedAt, "endedAt must not be null");
        Objects.requireNonNull(executionTime, "executionTime must not be null");
        Objects.requireNonNull(groups, "groups must not be null");
        Objects.requireNonNull(duplicates, "duplicates must not be null");
        Objects.requireNonNull(warnings, "warnings must not be null");
        groups = List.copyOf(groups);
        duplicates = Collections.unmodifiableMap(new LinkedHashMap<>(duplicates));
        warnings = List.copyOf(warnings);
    }

    /**
     * Report for an end without a begin: no groups, one warning.
     */
    public static Report unmatched(String contextId, ScopeWarning warning) {
        return new Report(contextId, Optional.empty(), Optional.empty(), Optional.empty(),
                List.of(), Map.of(), List.of(warning));
    }

    public int queryCount() {
        return groups.stream().mapToInt(GroupReport::queryCount).sum();
    }

    public Duration totalDbTime() {
        return groups.stream()
                .map(GroupReport::dbTime)
                .reduce(Duration.ZERO, Duration::plus);
    }

    /**
     * All queries in start order.
     */
    public List<QueryEvent> events() {
        return groups.stream()
                .flatMap(g -> g.events().stream())
                .sorted(Comparator.comparingInt(QueryEvent::sequence))
                .toList();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
