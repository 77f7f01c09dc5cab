package com.ormcost.adapter.jdbc;

import com.ormcost.adapter.ExecutionContextResolver;
import com.ormcost.capture.QueryEvent;
import com.ormcost.engine.QueryCostEngine;
import com.ormcost.grouping.RelationshipScope;
import com.ormcost.spi.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds deferred, instrumented queries over a plain JDBC connection.
 *
 * <p>A query built here does not touch the database until it is forced with
 * {@link LazyQuery#fetch()}. Origins are therefore resolved where results are first needed,
 * not where the query was declared.
 *
 * <pre>{@code
 * JdbcQuerySource source = new JdbcQuerySource(engine, ExecutionContextResolver.perThread(), connection);
 * LazyQuery users = source.query("users", "SELECT id, name, email FROM users");
 * for (TrackedRecord user : users.fetch()) {
 *     render(user.getString("name"));
 * }
 * }</pre>
 *
 * <p>When the resolver yields no context id the query still runs, uninstrumented, and its
 * records track nothing.
 */
public class JdbcQuerySource {

    private static final Logger log = LoggerFactory.getLogger(JdbcQuerySource.class);

    private final QueryCostEngine engine;
    private final ExecutionContextResolver contextResolver;
    private final Connection connection;

    private final AtomicLong executedQueries;

    /**
     * Creates a query source.
     *
     * @throws ConfigurationException if any collaborator is missing
     */
    public JdbcQuerySource(QueryCostEngine engine, ExecutionContextResolver contextResolver, Connection connection) {
        if (engine == null) {
            throw new ConfigurationException("JdbcQuerySource requires a QueryCostEngine");
        }
        if (contextResolver == null) {
            throw new ConfigurationException("JdbcQuerySource requires an ExecutionContextResolver");
        }
        if (connection == null) {
            throw new ConfigurationException("JdbcQuerySource requires a JDBC connection");
        }
        this.engine = engine;
        this.contextResolver = contextResolver;
        this.connection = connection;
        this.executedQueries = new AtomicLong(0);
    }

    /**
     * Declares a query without executing it.
     *
     * @param shape  table or entity name the rows belong to, used for record identity
     * @param sql    statement text with {@code ?} placeholders
     * @param params values bound to the placeholders in order
     */
    public LazyQuery query(String shape, String sql, Object... params) {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(sql, "sql must not be null");
        return new LazyQuery(this, shape, sql, params == null ? List.of() : Arrays.asList(params));
    }

    /**
     * Returns the number of statements this source sent to the database.
     */
    public long getExecutedQueryCount() {
        return executedQueries.get();
    }

    QueryCostEngine engine() {
        return engine;
    }

    Connection connection() {
        return connection;
    }

    /**
     * Returns the current context id, or {@code null} when none can be resolved and the
     * query should run uninstrumented.
     */
    String currentContextId() {
        try {
            return contextResolver.currentContextId();
        } catch (RuntimeException e) {
            log.warn("Could not resolve execution context; query runs uninstrumented", e);
            return null;
        }
    }

    RelationshipScope openRelationship(QueryEvent source, String relation) {
        String contextId = currentContextId();
        if (contextId == null || source == null) {
            return RelationshipScope.NOOP;
        }
        return engine.openRelationship(contextId, source, relation);
    }

    void executed() {
        executedQueries.incrementAndGet();
    }
}
