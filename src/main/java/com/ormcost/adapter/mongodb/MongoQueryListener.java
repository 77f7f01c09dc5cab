package com.ormcost.adapter.mongodb;

import com.ormcost.adapter.ExecutionContextResolver;
import com.ormcost.capture.QueryEvent;
import com.ormcost.capture.QueryToken;
import com.ormcost.engine.QueryCostEngine;
import com.ormcost.spi.ConfigurationException;
import com.mongodb.event.CommandFailedEvent;
import com.mongodb.event.CommandListener;
import com.mongodb.event.CommandStartedEvent;
import com.mongodb.event.CommandSucceededEvent;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * MongoDB CommandListener that reports every command round-trip to the query cost engine.
 *
 * <p>Register it on {@code MongoClientSettings.builder().addCommandListener(...)}. With the
 * synchronous driver, listener callbacks run on the thread that forced the query, so the origin
 * resolved at {@link #commandStarted} is the application frame that issued the command.
 *
 * <p>The statement is the command document without session and cluster bookkeeping fields.
 * Declared columns are known only for a {@code find} with an inclusion projection.
 *
 * <p>A {@code getMore} on a cursor opened by a reported command is not a new query: its
 * round-trip time is added to the query that opened the cursor. A {@code getMore} on a cursor
 * the listener never saw opened is not reported. {@code killCursors} only forgets the cursor.
 */
public class MongoQueryListener implements CommandListener {

    private static final Logger log = LoggerFactory.getLogger(MongoQueryListener.class);

    static final Set<String> IGNORED_COMMANDS = Set.of(
            "hello", "ismaster", "isMaster", "ping", "buildInfo",
            "saslStart", "saslContinue", "getnonce", "authenticate", "endSessions"
    );

    private static final String GET_MORE = "getMore";
    private static final String KILL_CURSORS = "killCursors";

    static final Set<String> BOOKKEEPING_FIELDS = Set.of(
            "lsid", "$db", "$clusterTime", "$readPreference", "txnNumber", "autocommit", "startTransaction"
    );

    private final QueryCostEngine engine;
    private final ExecutionContextResolver contextResolver;

    // Track pending commands by request ID
    private final Map<Integer, PendingCommand> pendingCommands;
    private final Map<Integer, Long> pendingBatches;
    private final Map<Long, QueryEvent> openCursors;

    private final AtomicLong completedCommands;
    private final AtomicLong failedCommands;

    /**
     * Creates a listener.
     *
     * @throws ConfigurationException if the engine or the context resolver is missing
     */
    public MongoQueryListener(QueryCostEngine engine, ExecutionContextResolver contextResolver) {
        if (engine == null) {
            throw new ConfigurationException("MongoQueryListener requires a QueryCostEngine");
        }
        if (contextResolver == null) {
            throw new ConfigurationException("MongoQueryListener requires an ExecutionContextResolver");
        }
        this.engine = engine;
        this.contextResolver = contextResolver;
        this.pendingCommands = new ConcurrentHashMap<>();
        this.pendingBatches = new ConcurrentHashMap<>();
        this.openCursors = new ConcurrentHashMap<>();
        this.completedCommands = new AtomicLong(0);
        this.failedCommands = new AtomicLong(0);
    }

    @Override
    public void commandStarted(CommandStartedEvent event) {
        String commandName = event.getCommandName();
        if (IGNORED_COMMANDS.contains(commandName)) {
            return;
        }
        try {
            if (GET_MORE.equals(commandName)) {
                long cursorId = cursorIdOf(event.getCommand().get(GET_MORE));
                if (openCursors.containsKey(cursorId)) {
                    pendingBatches.put(event.getRequestId(), cursorId);
                }
                return;
            }
            if (KILL_CURSORS.equals(commandName)) {
                forgetCursors(event.getCommand());
                return;
            }
            String contextId = contextResolver.currentContextId();
            if (contextId == null) {
                return;
            }
            BsonDocument command = event.getCommand();
            QueryToken token = engine.onQueryStart(contextId, statementOf(command));
            pendingCommands.put(event.getRequestId(), new PendingCommand(token, projectedFields(command)));
        } catch (RuntimeException e) {
            log.warn("Could not capture start of MongoDB command {}", event.getCommandName(), e);
        }
    }

    @Override
    public void commandSucceeded(CommandSucceededEvent event) {
        Long batchCursor = pendingBatches.remove(event.getRequestId());
        if (batchCursor != null) {
            continueCursor(batchCursor, event);
            return;
        }
        PendingCommand pending = pendingCommands.remove(event.getRequestId());
        if (pending == null) {
            // Orphaned event - command started before the listener saw it, or was ignored
            return;
        }
        QueryEvent recorded = engine.onQueryEnd(pending.token(), pending.declaredColumns());
        long cursorId = replyCursorId(event.getResponse());
        if (cursorId != 0L && !recorded.isDetached()) {
            openCursors.put(cursorId, recorded);
        }
        completedCommands.incrementAndGet();
    }

    @Override
    public void commandFailed(CommandFailedEvent event) {
        Long batchCursor = pendingBatches.remove(event.getRequestId());
        if (batchCursor != null) {
            openCursors.remove(batchCursor);
            failedCommands.incrementAndGet();
            return;
        }
        PendingCommand pending = pendingCommands.remove(event.getRequestId());
        if (pending != null) {
            engine.onQueryFailed(pending.token(), event.getThrowable());
        }
        failedCommands.incrementAndGet();
    }

    public long getCompletedCommandCount() {
        return completedCommands.get();
    }

    public long getFailedCommandCount() {
        return failedCommands.get();
    }

    /**
     * Returns the number of commands started but not yet finished.
     */
    public int getPendingCommandCount() {
        return pendingCommands.size();
    }

    /**
     * Returns the number of cursors whose further batches are still expected.
     */
    public int getOpenCursorCount() {
        return openCursors.size();
    }

    private void continueCursor(long cursorId, CommandSucceededEvent event) {
        boolean exhausted = replyCursorId(event.getResponse()) == 0L;
        QueryEvent source = exhausted ? openCursors.remove(cursorId) : openCursors.get(cursorId);
        if (source != null) {
            engine.onQueryContinued(source, Duration.ofNanos(event.getElapsedTime(TimeUnit.NANOSECONDS)));
        }
    }

    private void forgetCursors(BsonDocument command) {
        BsonValue cursors = command.get("cursors");
        if (cursors != null && cursors.isArray()) {
            for (BsonValue cursorId : cursors.asArray()) {
                openCursors.remove(cursorIdOf(cursorId));
            }
        }
    }

    /**
     * Cursor id of a {@code find}, {@code aggregate} or {@code getMore} reply; 0 once exhausted.
     */
    static long replyCursorId(BsonDocument reply) {
        if (reply == null) {
            return 0L;
        }
        BsonValue cursor = reply.get("cursor");
        if (cursor == null || !cursor.isDocument()) {
            return 0L;
        }
        return cursorIdOf(cursor.asDocument().get("id"));
    }

    private static long cursorIdOf(BsonValue value) {
        return value != null && value.isNumber() ? value.asNumber().longValue() : 0L;
    }

    /**
     * Command document as JSON, without session and cluster bookkeeping fields.
     */
    static String statementOf(BsonDocument command) {
        BsonDocument statement = new BsonDocument();
        for (Map.Entry<String, BsonValue> entry : command.entrySet()) {
            if (!BOOKKEEPING_FIELDS.contains(entry.getKey())) {
                statement.put(entry.getKey(), entry.getValue());
            }
        }
        return statement.toJson();
    }

    /**
     * Returns the fields a {@code find} command projects, or {@code null} when the command
     * returns whole documents or uses an exclusion projection.
     */
    static List<String> projectedFields(BsonDocument command) {
        if (!command.containsKey("find")) {
            return null;
        }
        BsonValue projection = command.get("projection");
        if (projection == null || !projection.isDocument() || projection.asDocument().isEmpty()) {
            return null;
        }
        List<String> fields = new ArrayList<>();
        boolean includeId = true;
        for (Map.Entry<String, BsonValue> entry : projection.asDocument().entrySet()) {
            String field = entry.getKey();
            boolean included = isIncluded(entry.getValue());
            if (field.equals("_id")) {
                includeId = included;
            } else if (included) {
                fields.add(field);
            } else {
                // exclusion projection: the returned fields are whatever the documents hold
                return null;
            }
        }
        if (fields.isEmpty()) {
            // {_id: 1} alone returns only _id; {_id: 0} alone is an exclusion
            return includeId ? List.of("_id") : null;
        }
        if (includeId) {
            fields.add(0, "_id");
        }
        return fields;
    }

    private static boolean isIncluded(BsonValue value) {
        if (value.isBoolean()) {
            return value.asBoolean().getValue();
        }
        if (value.isNumber()) {
            return value.asNumber().intValue() != 0;
        }
        // expressions such as $slice or $elemMatch still return the field
        return true;
    }

    private record PendingCommand(QueryToken token, List<String> declaredColumns) {
    }
}
