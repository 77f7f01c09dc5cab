package com.ormcost.engine;

import com.ormcost.capture.QueryToken;
import com.ormcost.grouping.GroupingEngine;
import com.ormcost.grouping.QueryGroup;
import com.ormcost.report.Report;
import com.ormcost.report.ScopeWarning;
import com.ormcost.tracking.FieldAccessTracker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * The bounded scope of instrumentation for one execution context, typically one request.
 *
 * <p>Use with try-with-resources so the context is released even when the operation fails;
 * closing ends the unit of work if it is still active. State is local to the owning context
 * and not synchronized.
 */
public final class UnitOfWork implements AutoCloseable {

    private final String id;
    private final String contextId;
    private final QueryCostEngine engine;
    private final Instant startedAt;
    private final OptionalLong startNanos;
    private final boolean registered;

    private final GroupingEngine grouping = new GroupingEngine();
    private final FieldAccessTracker tracker = new FieldAccessTracker();
    private final Map<Integer, QueryToken> pending = new LinkedHashMap<>();
    private final List<ScopeWarning> warnings = new ArrayList<>();

    private Instant endedAt;
    private Duration executionTime;
    private Report report;

    UnitOfWork(String contextId, QueryCostEngine engine, Instant startedAt,
               OptionalLong startNanos, boolean registered) {
        this.id = UUID.randomUUID().toString();
        this.contextId = Objects.requireNonNull(contextId, "contextId must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.startedAt = startedAt;
        this.startNanos = startNanos;
        this.registered = registered;
    }

    public String getId() {
        return id;
    }

    public String getContextId() {
        return contextId;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getEndedAt() {
        return Optional.ofNullable(endedAt);
    }

    public Optional<Duration> getExecutionTime() {
        return Optional.ofNullable(executionTime);
    }

    public List<QueryGroup> getGroups() {
        return grouping.getGroups();
    }

    public List<ScopeWarning> getWarnings() {
        return List.copyOf(warnings);
    }

    /**
     * True while queries and field reads are being recorded.
     */
    public boolean isActive() {
        return report == null;
    }

    /**
     * False for a unit of work rejected because its context already had an active one.
     */
    public boolean isRegistered() {
        return registered;
    }

    public Optional<Report> getReport() {
        return Optional.ofNullable(report);
    }

    /**
     * Ends this unit of work if it is still active.
     */
    @Override
    public void close() {
        if (isActive()) {
            engine.end(this);
        }
    }

    GroupingEngine grouping() {
        return grouping;
    }

    /**
     * Returns the field access tracker of this unit of work; it stops accepting reads once the unit ends.
     */
    public FieldAccessTracker getTracker() {
        return tracker;
    }

    void addWarning(ScopeWarning warning) {
        warnings.add(warning);
    }

    void queryStarted(QueryToken token) {
        pending.put(token.getSequence(), token);
    }

    void queryFinished(QueryToken token) {
        pending.remove(token.getSequence());
    }

    /**
     * Returns and forgets the queries that started but never ended.
     */
    List<QueryToken> drainPending() {
        List<QueryToken> abandoned = new ArrayList<>(pending.values());
        pending.clear();
        return abandoned;
    }

    OptionalLong startNanos() {
        return startNanos;
    }

    void markEnded(Instant endedAt, Duration executionTime) {
        this.endedAt = endedAt;
        this.executionTime = executionTime;
        tracker.close();
    }

    void complete(Report report) {
        this.report = report;
    }
}
