package com.ormcost.capture;

import com.ormcost.grouping.GroupAssignment;
import com.ormcost.origin.Origin;
import com.ormcost.util.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Records query round-trips: statement, optional parameters, start and monotonic duration.
 *
 * <p>A pure observer. When the clock cannot be read the event is recorded without timing;
 * capture never throws into the query path.
 */
public final class QueryCapture {

    private static final Logger log = LoggerFactory.getLogger(QueryCapture.class);

    static final String ABANDONED = "query did not complete before the unit of work ended";

    private final TimeSource timeSource;
    private final boolean captureParameters;

    public QueryCapture(TimeSource timeSource, boolean captureParameters) {
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
        this.captureParameters = captureParameters;
    }

    /**
     * Marks the start of a round-trip.
     */
    public QueryToken start(String unitOfWorkId,
                            String contextId,
                            String statement,
                            List<?> parameters,
                            Origin origin,
                            GroupAssignment assignment) {
        List<Object> captured = captureParameters && parameters != null
                ? new ArrayList<Object>(parameters)
                : List.of();
        Instant startedAt = timeSource.tryNow().orElse(null);
        OptionalLong startNanos = timeSource.tryNanoTime();
        if (startedAt == null || startNanos.isEmpty()) {
            warnClock(statement);
        }
        return new QueryToken(unitOfWorkId, contextId, statement, captured, startedAt, startNanos, origin, assignment);
    }

    /**
     * Marks successful completion.
     *
     * @param declaredColumns output columns of the statement, or {@code null} when unknown
     */
    public QueryEvent end(QueryToken token, List<String> declaredColumns) {
        return token.complete(toEvent(token, measure(token), declaredColumns, null));
    }

    /**
     * Marks a failed round-trip; the event keeps its timing and records the failure message.
     */
    public QueryEvent fail(QueryToken token, Throwable failure) {
        String message = failure == null ? "unknown failure"
                : failure.getClass().getSimpleName() + ": " + failure.getMessage();
        return token.complete(toEvent(token, measure(token), null, message));
    }

    /**
     * Records a query that was started but never ended.
     */
    public QueryEvent abandon(QueryToken token) {
        return token.complete(toEvent(token, Optional.empty(), null, ABANDONED));
    }

    private QueryEvent toEvent(QueryToken token,
                               Optional<Duration> duration,
                               List<String> declaredColumns,
                               String failure) {
        GroupAssignment assignment = token.getAssignment();
        return new QueryEvent(
                token.getUnitOfWorkId(),
                token.getContextId(),
                assignment.sequence(),
                token.getStatement(),
                token.parameters(),
                token.startedAt(),
                duration,
                token.getOrigin(),
                assignment.groupId(),
                assignment.relationPath(),
                assignment.primary(),
                Optional.ofNullable(declaredColumns),
                Optional.ofNullable(failure)
        );
    }

    private Optional<Duration> measure(QueryToken token) {
        if (token.startNanos().isEmpty()) {
            return Optional.empty();
        }
        Optional<Duration> duration = timeSource.elapsedSince(token.startNanos());
        if (duration.isEmpty()) {
            warnClock(token.getStatement());
        }
        return duration;
    }

    private static void warnClock(String statement) {
        log.warn("Clock unavailable; recording query without timing: {}", statement);
    }
}
