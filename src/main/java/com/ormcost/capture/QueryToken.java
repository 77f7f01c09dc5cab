package com.ormcost.capture;

import com.ormcost.grouping.GroupAssignment;
import com.ormcost.origin.Origin;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle for a query between {@code onQueryStart} and {@code onQueryEnd}.
 * Ending a token a second time returns the event recorded the first time.
 */
public final class QueryToken {

    private final String unitOfWorkId;
    private final String contextId;
    private final String statement;
    private final List<Object> parameters;
    private final Instant startedAt;
    private final OptionalLong startNanos;
    private final Origin origin;
    private final GroupAssignment assignment;
    private final AtomicReference<QueryEvent> completed = new AtomicReference<>();

    QueryToken(String unitOfWorkId,
               String contextId,
               String statement,
               List<Object> parameters,
               Instant startedAt,
               OptionalLong startNanos,
               Origin origin,
               GroupAssignment assignment) {
        this.unitOfWorkId = Objects.requireNonNull(unitOfWorkId, "unitOfWorkId must not be null");
        this.contextId = Objects.requireNonNull(contextId, "contextId must not be null");
        this.statement = Objects.requireNonNull(statement, "statement must not be null");
        this.parameters = parameters;
        this.startedAt = startedAt;
        this.startNanos = startNanos;
        this.origin = Objects.requireNonNull(origin, "origin must not be null");
        this.assignment = Objects.requireNonNull(assignment, "assignment must not be null");
    }

    public String getUnitOfWorkId() {
        return unitOfWorkId;
    }

    public String getContextId() {
        return contextId;
    }

    public String getStatement() {
        return statement;
    }

    public Origin getOrigin() {
        return origin;
    }

    public GroupAssignment getAssignment() {
        return assignment;
    }

    public int getSequence() {
        return assignment.sequence();
    }

    /**
     * True when the query started outside any unit of work; its event is not reported.
     */
    public boolean isDetached() {
        return assignment.isDetached();
    }

    public boolean isCompleted() {
        return completed.get() != null;
    }

    public Optional<QueryEvent> getEvent() {
        return Optional.ofNullable(completed.get());
    }

    List<Object> parameters() {
        return parameters;
    }

    Optional<Instant> startedAt() {
        return Optional.ofNullable(startedAt);
    }

    OptionalLong startNanos() {
        return startNanos;
    }

    /**
     * Records the event unless one was recorded before.
     *
     * @return the event that is now attached to this token
     */
    QueryEvent complete(QueryEvent event) {
        if (completed.compareAndSet(null, event)) {
            return event;
        }
        return completed.get();
    }
}
