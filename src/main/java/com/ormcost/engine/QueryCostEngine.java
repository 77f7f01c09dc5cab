package com.ormcost.engine;

import com.ormcost.capture.QueryCapture;
import com.ormcost.capture.QueryEvent;
import com.ormcost.capture.QueryToken;
import com.ormcost.grouping.GroupAssignment;
import com.ormcost.grouping.QueryGroup;
import com.ormcost.grouping.RelationshipScope;
import com.ormcost.origin.InternalFrameFilter;
import com.ormcost.origin.Origin;
import com.ormcost.origin.OriginResolver;
import com.ormcost.report.Report;
import com.ormcost.report.ReportAggregator;
import com.ormcost.report.ReportLogger;
import com.ormcost.report.ScopeWarning;
import com.ormcost.spi.ConfigurationException;
import com.ormcost.spi.ValidationResult;
import com.ormcost.tracking.RecordHandle;
import com.ormcost.tracking.RecordIdentity;
import com.ormcost.tracking.TrackedRecord;
import com.ormcost.util.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.Callable;

/**
 * Entry point used by the host integration layer.
 *
 * <p>Every hook takes the execution-context id explicitly and resolves the active unit of work
 * through a synchronized registry. Hooks never throw into the observed operation: failures are
 * logged and the affected event is recorded with degraded fields. Only construction fails fast,
 * with {@link ConfigurationException}.
 */
public final class QueryCostEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryCostEngine.class);

    private static final String DETACHED_UNIT = "";

    private final EngineConfig config;
    private final TimeSource timeSource;
    private final ScopeRegistry registry;
    private final OriginResolver originResolver;
    private final QueryCapture capture;
    private final ReportAggregator aggregator;
    private final ReportLogger reportLogger;

    /**
     * Creates an engine.
     *
     * @throws ConfigurationException if the configuration is invalid
     */
    public QueryCostEngine(EngineConfig config, TimeSource timeSource) {
        if (config == null) {
            throw new ConfigurationException("engine configuration is required");
        }
        if (timeSource == null) {
            throw new ConfigurationException(ValidationResult.failure("timeSource", "a time source is required"));
        }
        config.validate().throwIfInvalid();

        this.config = config;
        this.timeSource = timeSource;
        this.registry = new ScopeRegistry();
        this.originResolver = new OriginResolver(new InternalFrameFilter(config.internalPrefixes()));
        this.capture = new QueryCapture(timeSource, config.captureParameters());
        this.aggregator = new ReportAggregator();
        this.reportLogger = new ReportLogger();
    }

    public EngineConfig getConfig() {
        return config;
    }

    // Unit of work lifecycle

    /**
     * Starts instrumenting the given execution context.
     *
     * <p>If the context already has an active unit of work, that one stays active and records a
     * {@link ScopeWarning.Kind#NESTED_BEGIN} warning; the returned unit of work is a detached
     * placeholder whose report carries the same warning.
     */
    public UnitOfWork beginUnitOfWork(String contextId) {
        Objects.requireNonNull(contextId, "contextId must not be null");
        UnitOfWork candidate = newUnitOfWork(contextId, true);
        Optional<UnitOfWork> existing = registry.register(candidate);
        if (existing.isEmpty()) {
            log.debug("Began unit of work {} for context {}", candidate.getId(), contextId);
            return candidate;
        }

        ScopeWarning warning = new ScopeWarning(ScopeWarning.Kind.NESTED_BEGIN, contextId,
                "beginUnitOfWork called while unit of work " + existing.get().getId() + " is active");
        log.warn("{}: {}", warning.kind(), warning.message());
        existing.get().addWarning(warning);

        UnitOfWork rejected = newUnitOfWork(contextId, false);
        rejected.addWarning(warning);
        return rejected;
    }

    /**
     * Ends the active unit of work of the context and returns its report.
     * Without a matching begin, returns an empty report carrying an
     * {@link ScopeWarning.Kind#UNMATCHED_END} warning.
     */
    public Report endUnitOfWork(String contextId) {
        Objects.requireNonNull(contextId, "contextId must not be null");
        Optional<UnitOfWork> active = registry.find(contextId);
        if (active.isEmpty()) {
            ScopeWarning warning = new ScopeWarning(ScopeWarning.Kind.UNMATCHED_END, contextId,
                    "endUnitOfWork called with no active unit of work");
            log.warn("{}: {}", warning.kind(), warning.message());
            return Report.unmatched(contextId, warning);
        }
        return end(active.get());
    }

    /**
     * Runs the callable inside a unit of work that is ended even if the callable throws.
     */
    public <T> Observed<T> runInUnitOfWork(String contextId, Callable<T> work) throws Exception {
        Objects.requireNonNull(work, "work must not be null");
        UnitOfWork unitOfWork = beginUnitOfWork(contextId);
        T result;
        try {
            result = work.call();
        } finally {
            unitOfWork.close();
        }
        return new Observed<>(result, unitOfWork.getReport().orElseThrow());
    }

    public Optional<UnitOfWork> currentUnitOfWork(String contextId) {
        return registry.find(contextId);
    }

    public int getActiveUnitOfWorkCount() {
        return registry.size();
    }

    // Query execution hooks

    public QueryToken onQueryStart(String contextId, String statementText) {
        return onQueryStart(contextId, statementText, List.of());
    }

    /**
     * Called when a query is forced, immediately before its round-trip. Resolves the origin from
     * the current stack and assigns the query to a group.
     */
    public QueryToken onQueryStart(String contextId, String statementText, List<?> parameters) {
        Objects.requireNonNull(contextId, "contextId must not be null");
        Objects.requireNonNull(statementText, "statementText must not be null");
        Optional<UnitOfWork> active = registry.find(contextId);
        if (active.isEmpty()) {
            log.debug("No unit of work for context {}; query not attributed", contextId);
            return capture.start(DETACHED_UNIT, contextId, statementText, parameters,
                    Origin.UNATTRIBUTED, GroupAssignment.detached());
        }
        UnitOfWork unitOfWork = active.get();
        try {
            Origin origin = originResolver.resolve();
            GroupAssignment assignment = unitOfWork.grouping().assignGroup(origin);
            QueryToken token = capture.start(unitOfWork.getId(), contextId, statementText, parameters,
                    origin, assignment);
            unitOfWork.queryStarted(token);
            return token;
        } catch (RuntimeException e) {
            log.warn("Could not instrument query start in context {}; query not attributed", contextId, e);
            return capture.start(DETACHED_UNIT, contextId, statementText, parameters,
                    Origin.UNATTRIBUTED, GroupAssignment.detached());
        }
    }

    /**
     * Called after a round-trip whose output columns are unknown.
     */
    public QueryEvent onQueryEnd(QueryToken token) {
        return onQueryEnd(token, null);
    }

    /**
     * Called after a successful round-trip.
     *
     * @param declaredColumns output columns of the statement, or {@code null} when unknown
     */
    public QueryEvent onQueryEnd(QueryToken token, List<String> declaredColumns) {
        Objects.requireNonNull(token, "token must not be null");
        if (token.isCompleted()) {
            log.debug("Query {} already ended", token.getSequence());
            return token.getEvent().orElseThrow();
        }
        return record(token, capture.end(token, declaredColumns));
    }

    /**
     * Called when a round-trip fails. The failure is recorded; it is not rethrown.
     */
    public QueryEvent onQueryFailed(QueryToken token, Throwable failure) {
        Objects.requireNonNull(token, "token must not be null");
        if (token.isCompleted()) {
            return token.getEvent().orElseThrow();
        }
        return record(token, capture.fail(token, failure));
    }

    /**
     * Called after a follow-up round-trip that fetched more rows for {@code source}, such as the
     * next batch of a cursor. Its time is added to {@code source}; no query or group is created.
     */
    public void onQueryContinued(QueryEvent source, Duration roundTrip) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(roundTrip, "roundTrip must not be null");
        try {
            boolean extended = findOwner(source.contextId(), source)
                    .flatMap(u -> u.grouping().findGroup(source.groupId()))
                    .map(group -> group.extend(source.sequence(), roundTrip))
                    .orElse(false);
            if (!extended) {
                log.debug("Follow-up of query {} outside its unit of work; dropped", source.sequence());
            }
        } catch (RuntimeException e) {
            log.warn("Could not add follow-up round-trip to query {}", source.sequence(), e);
        }
    }

    /**
     * Resolves the origin of a query forced at this moment.
     */
    public Origin resolveOrigin() {
        return originResolver.resolve();
    }

    // Relationship resolution hooks

    /**
     * Called by the record layer before it fires the queries that resolve {@code relation} on
     * records materialized by {@code source}. Queries started inside the scope become dependents.
     */
    public RelationshipScope openRelationship(String contextId, QueryEvent source, String relation) {
        Objects.requireNonNull(source, "source must not be null");
        Optional<UnitOfWork> active = findOwner(contextId, source);
        if (active.isEmpty()) {
            return RelationshipScope.NOOP;
        }
        try {
            return active.get().grouping().openRelationship(source.groupId(), source.relationPath(), relation);
        } catch (RuntimeException e) {
            log.warn("Could not open relationship '{}' in context {}", relation, contextId, e);
            return RelationshipScope.NOOP;
        }
    }

    /**
     * Opens a relationship scope whose source is the innermost open scope or the latest group.
     */
    public RelationshipScope openRelationship(String contextId, String relation) {
        Optional<UnitOfWork> active = registry.find(contextId);
        if (active.isEmpty()) {
            return RelationshipScope.NOOP;
        }
        try {
            return active.get().grouping().openRelationship(relation);
        } catch (RuntimeException e) {
            log.warn("Could not open relationship '{}' in context {}", relation, contextId, e);
            return RelationshipScope.NOOP;
        }
    }

    // Field access hooks

    /**
     * Registers a record materialized from {@code source} for field tracking.
     */
    public RecordHandle registerRecord(QueryEvent source, RecordIdentity identity) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(identity, "identity must not be null");
        Optional<UnitOfWork> owner = findOwner(source.contextId(), source);
        if (owner.isEmpty()) {
            return RecordHandle.untracked(source, identity);
        }
        return owner.get().getTracker().register(source, identity);
    }

    /**
     * Registers a record and wraps its values so every field read is reported.
     */
    public TrackedRecord track(QueryEvent source, RecordIdentity identity, Map<String, ?> values) {
        return new TrackedRecord(registerRecord(source, identity), values);
    }

    public void onFieldRead(RecordHandle handle, String fieldName) {
        Objects.requireNonNull(handle, "handle must not be null");
        try {
            if (handle.isTracked()) {
                handle.getSource()
                        .flatMap(source -> findOwner(source.contextId(), source))
                        .ifPresent(owner -> owner.getTracker().onFieldRead(handle, fieldName));
            }
        } catch (RuntimeException e) {
            log.warn("Could not record read of '{}' on {}", fieldName, handle.getIdentity(), e);
        }
    }

    /**
     * Records a field read by identity; attributed to the group that last materialized the record.
     */
    public void onFieldRead(String contextId, RecordIdentity identity, String fieldName) {
        try {
            registry.find(contextId).ifPresent(u -> u.getTracker().onFieldRead(identity, fieldName));
        } catch (RuntimeException e) {
            log.warn("Could not record read of '{}' on {}", fieldName, identity, e);
        }
    }

    // Internals

    Report end(UnitOfWork unitOfWork) {
        Optional<Report> existing = unitOfWork.getReport();
        if (existing.isPresent()) {
            return existing.get();
        }
        registry.release(unitOfWork);

        List<QueryToken> abandoned = unitOfWork.drainPending();
        for (QueryToken token : abandoned) {
            QueryEvent event = capture.abandon(token);
            attach(unitOfWork, event);
        }
        if (!abandoned.isEmpty()) {
            unitOfWork.addWarning(new ScopeWarning(ScopeWarning.Kind.INCOMPLETE_QUERY,
                    unitOfWork.getContextId(), abandoned.size() + " query(s) still running at end"));
        }
        int unbalanced = unitOfWork.grouping().finish();
        if (unbalanced > 0) {
            unitOfWork.addWarning(new ScopeWarning(ScopeWarning.Kind.UNBALANCED_RELATIONSHIP,
                    unitOfWork.getContextId(), unbalanced + " relationship scope(s) still open at end"));
        }

        unitOfWork.markEnded(readInstant(), timeSource.elapsedSince(unitOfWork.startNanos()).orElse(null));
        Report report = aggregator.finalizeReport(unitOfWork);
        unitOfWork.complete(report);

        if (config.logReports()) {
            try {
                reportLogger.log(report);
            } catch (RuntimeException e) {
                log.warn("Could not log report for context {}", unitOfWork.getContextId(), e);
            }
        }
        log.debug("Ended unit of work {} for context {}", unitOfWork.getId(), unitOfWork.getContextId());
        return report;
    }

    private QueryEvent record(QueryToken token, QueryEvent event) {
        if (token.isDetached()) {
            return event;
        }
        registry.find(token.getContextId())
                .filter(u -> u.getId().equals(token.getUnitOfWorkId()))
                .ifPresentOrElse(
                        u -> {
                            u.queryFinished(token);
                            attach(u, event);
                        },
                        () -> log.debug("Query {} ended after its unit of work; dropped", token.getSequence()));
        return event;
    }

    private void attach(UnitOfWork unitOfWork, QueryEvent event) {
        try {
            Optional<QueryGroup> group = unitOfWork.grouping().findGroup(event.groupId());
            if (group.isPresent()) {
                group.get().attach(event);
            } else {
                log.warn("Query {} refers to unknown group {}", event.sequence(), event.groupId());
            }
        } catch (RuntimeException e) {
            log.warn("Could not attach query {} to group {}", event.sequence(), event.groupId(), e);
        }
    }

    private Optional<UnitOfWork> findOwner(String contextId, QueryEvent source) {
        if (contextId == null || source.isDetached()) {
            return Optional.empty();
        }
        return registry.find(contextId).filter(u -> u.getId().equals(source.unitOfWorkId()));
    }

    private UnitOfWork newUnitOfWork(String contextId, boolean registered) {
        Instant startedAt = readInstant();
        OptionalLong startNanos = timeSource.tryNanoTime();
        if (startNanos.isEmpty()) {
            log.warn("Clock unavailable; execution time of context {} not recorded", contextId);
        }
        return new UnitOfWork(contextId, this, startedAt, startNanos, registered);
    }

    private Instant readInstant() {
        Optional<Instant> now = timeSource.tryNow();
        if (now.isEmpty()) {
            log.warn("Clock unavailable; unit of work timestamp not recorded");
        }
        return now.orElse(null);
    }
}
