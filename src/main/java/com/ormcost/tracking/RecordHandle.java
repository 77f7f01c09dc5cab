package com.ormcost.tracking;

import com.ormcost.capture.QueryEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * Link between a materialized record and the tracker of its unit of work.
 * Handles for records produced outside a unit of work track nothing.
 */
public final class RecordHandle {

    private final FieldAccessTracker tracker;
    private final QueryEvent source;
    private final RecordIdentity identity;
    private final FieldAccessRecord record;

    RecordHandle(FieldAccessTracker tracker, QueryEvent source, RecordIdentity identity, FieldAccessRecord record) {
        this.tracker = tracker;
        this.source = source;
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
        this.record = record;
    }

    /**
     * Returns a handle whose reads are ignored.
     */
    public static RecordHandle untracked(QueryEvent source, RecordIdentity identity) {
        return new RecordHandle(null, source, identity, null);
    }

    public RecordIdentity getIdentity() {
        return identity;
    }

    /**
     * Returns the query event that materialized the record, if known.
     */
    public Optional<QueryEvent> getSource() {
        return Optional.ofNullable(source);
    }

    public boolean isTracked() {
        return tracker != null && tracker.isActive();
    }

    void markRead(String field) {
        if (tracker != null) {
            tracker.onFieldRead(this, field);
        }
    }

    FieldAccessRecord record() {
        return record;
    }
}
