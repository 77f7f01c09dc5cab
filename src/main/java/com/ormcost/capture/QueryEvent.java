package com.ormcost.capture;

import com.ormcost.grouping.GroupId;
import com.ormcost.grouping.RelationPath;
import com.ormcost.origin.Origin;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One database round-trip, immutable once recorded.
 *
 * @param unitOfWorkId    identifier of the owning unit of work, empty when detached
 * @param contextId       execution context of the owning unit of work
 * @param sequence        start order within the unit of work (1-based, 0 when detached)
 * @param statement       exact statement text as executed
 * @param parameters      bound parameters; empty unless parameter capture is enabled
 * @param startedAt       wall-clock start, empty if the clock could not be read
 * @param duration        monotonic duration, empty if the clock could not be read
 * @param origin          application call site that forced the query
 * @param groupId         owning group
 * @param relationPath    relationship path for a dependent, root for a primary
 * @param primary         whether this query opened its group
 * @param declaredColumns output columns declared by the integration layer; empty when unknown
 * @param failure         failure message if the round-trip failed
 */
public record QueryEvent(
        String unitOfWorkId,
        String contextId,
        int sequence,
        String statement,
        List<Object> parameters,
        Optional<Instant> startedAt,
        Optional<Duration> duration,
        Origin origin,
        GroupId groupId,
        RelationPath relationPath,
        boolean primary,
        Optional<List<String>> declaredColumns,
        Optional<String> failure
) {

    public QueryEvent {
        Objects.requireNonNull(unitOfWorkId, "unitOfWorkId must not be null");
        Objects.requireNonNull(contextId, "contextId must not be null");
        Objects.requireNonNull(statement, "statement must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
        Objects.requireNonNull(groupId, "groupId must not be null");
        Objects.requireNonNull(relationPath, "relationPath must not be null");
        Objects.requireNonNull(declaredColumns, "declaredColumns must not be null");
        Objects.requireNonNull(failure, "failure must not be null");
        // parameters may legitimately contain nulls
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        declaredColumns = declaredColumns.map(List::copyOf);
    }

    /**
     * Returns this event with the time of a follow-up round-trip added, such as a cursor batch.
     * An unknown duration stays unknown.
     */
    public QueryEvent extendedBy(Duration roundTrip) {
        return new QueryEvent(unitOfWorkId, contextId, sequence, statement, parameters, startedAt,
                duration.map(d -> d.plus(roundTrip)), origin, groupId, relationPath, primary,
                declaredColumns, failure);
    }

    /**
     * Statement with runs of whitespace collapsed, used to detect repeated queries.
     */
    public String normalizedStatement() {
        return normalize(statement);
    }

    public boolean hasKnownColumns() {
        return declaredColumns.isPresent();
    }

    public boolean isFailed() {
        return failure.isPresent();
    }

    public boolean isDetached() {
        return groupId.isDetached();
    }

    public static String normalize(String statement) {
        return String.join(" ", statement.trim().split("\\s+"));
    }
}
