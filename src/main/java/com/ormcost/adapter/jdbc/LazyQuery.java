package com.ormcost.adapter.jdbc;

import com.ormcost.capture.QueryEvent;
import com.ormcost.capture.QueryToken;
import com.ormcost.engine.QueryCostEngine;
import com.ormcost.grouping.RelationshipScope;
import com.ormcost.tracking.RecordHandle;
import com.ormcost.tracking.RecordIdentity;
import com.ormcost.tracking.TrackedRecord;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A query that runs the first time its results are needed.
 *
 * <p>Forcing reports the round-trip to the engine, declares the result columns from
 * {@link ResultSetMetaData}, and wraps every row in a {@link TrackedRecord}. Results are cached;
 * later calls to {@link #fetch()} return them without another round-trip.
 *
 * <p>Not thread-safe, like the JDBC connection it runs on.
 */
public final class LazyQuery {

    static final String DEFAULT_KEY_COLUMN = "id";

    private final JdbcQuerySource source;
    private final String shape;
    private final String sql;
    private final List<Object> parameters;
    private String keyColumn = DEFAULT_KEY_COLUMN;

    private List<TrackedRecord> results;
    private QueryEvent event;

    LazyQuery(JdbcQuerySource source, String shape, String sql, List<Object> parameters) {
        this.source = source;
        this.shape = shape;
        this.sql = sql;
        this.parameters = parameters;
    }

    /**
     * Sets the column whose value identifies a row; rows without it are identified by instance.
     */
    public LazyQuery keyColumn(String keyColumn) {
        this.keyColumn = Objects.requireNonNull(keyColumn, "keyColumn must not be null");
        return this;
    }

    public String getShape() {
        return shape;
    }

    public String getSql() {
        return sql;
    }

    public boolean isEvaluated() {
        return results != null;
    }

    /**
     * Returns the recorded event once the query has been forced.
     */
    public Optional<QueryEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    /**
     * Forces the query, or returns the rows of the earlier evaluation.
     *
     * @throws SQLException if the statement fails; the failure is recorded before it is rethrown,
     *                      as is any runtime exception from the driver
     */
    public List<TrackedRecord> fetch() throws SQLException {
        if (results == null) {
            results = execute();
        }
        return results;
    }

    /**
     * Forces this query, then loads {@code relation} for its rows with {@code related}.
     * The related round-trip is reported as a dependent of this query's group.
     *
     * @return the related rows
     */
    public List<TrackedRecord> prefetch(String relation, LazyQuery related) throws SQLException {
        Objects.requireNonNull(related, "related must not be null");
        fetch();
        try (RelationshipScope scope = source.openRelationship(event, relation)) {
            return related.fetch();
        }
    }

    private List<TrackedRecord> execute() throws SQLException {
        QueryCostEngine engine = source.engine();
        String contextId = source.currentContextId();
        QueryToken token = contextId != null ? engine.onQueryStart(contextId, sql, parameters) : null;

        List<String> columns = new ArrayList<>();
        List<Map<String, Object>> rows = new ArrayList<>();
        try (PreparedStatement stmt = source.connection().prepareStatement(sql)) {
            for (int i = 0; i < parameters.size(); i++) {
                stmt.setObject(i + 1, parameters.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                ResultSetMetaData metaData = rs.getMetaData();
                for (int i = 1; i <= metaData.getColumnCount(); i++) {
                    columns.add(metaData.getColumnLabel(i));
                }
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 0; i < columns.size(); i++) {
                        row.put(columns.get(i), rs.getObject(i + 1));
                    }
                    rows.add(row);
                }
            }
        } catch (SQLException | RuntimeException e) {
            if (token != null) {
                engine.onQueryFailed(token, e);
            }
            throw e;
        } finally {
            source.executed();
        }

        List<TrackedRecord> records = new ArrayList<>(rows.size());
        if (token == null) {
            for (Map<String, Object> row : rows) {
                records.add(new TrackedRecord(RecordHandle.untracked(null, identityOf(row)), row));
            }
            return List.copyOf(records);
        }
        event = engine.onQueryEnd(token, columns);
        for (Map<String, Object> row : rows) {
            records.add(engine.track(event, identityOf(row), row));
        }
        return List.copyOf(records);
    }

    private RecordIdentity identityOf(Map<String, Object> row) {
        Object key = row.get(keyColumn);
        return key != null ? RecordIdentity.of(shape, key) : RecordIdentity.ofInstance(shape, row);
    }

    @Override
    public String toString() {
        return "LazyQuery[" + shape + ", " + (isEvaluated() ? "evaluated" : "deferred") + "]";
    }
}
