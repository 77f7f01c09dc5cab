package com.ormcost.tracking;

import com.ormcost.capture.QueryEvent;
import com.ormcost.grouping.GroupId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Accumulates which fields application code reads on records materialized during one unit of work.
 *
 * <p>Records are registered against a completed {@link QueryEvent}, so every access is attributed to
 * a group that has already executed. After {@link #close()} reads are dropped silently.
 * One instance per unit of work; not thread-safe.
 */
public final class FieldAccessTracker {

    private static final Logger log = LoggerFactory.getLogger(FieldAccessTracker.class);

    private final Map<GroupId, Map<RecordIdentity, FieldAccessRecord>> recordsByGroup = new LinkedHashMap<>();
    private final Map<RecordIdentity, FieldAccessRecord> latestByIdentity = new HashMap<>();
    private boolean active = true;

    /**
     * Registers a record materialized from the given event.
     */
    public RecordHandle register(QueryEvent source, RecordIdentity identity) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(identity, "identity must not be null");
        if (!active || source.isDetached()) {
            return RecordHandle.untracked(source, identity);
        }
        FieldAccessRecord record = recordsByGroup
                .computeIfAbsent(source.groupId(), id -> new LinkedHashMap<>())
                .computeIfAbsent(identity, id -> new FieldAccessRecord(source.groupId(), id, source.relationPath()));
        latestByIdentity.put(identity, record);
        return new RecordHandle(this, source, identity, record);
    }

    /**
     * Records a field read through a handle.
     */
    public void onFieldRead(RecordHandle handle, String field) {
        if (!active) {
            log.trace("Dropping read of '{}' on {}: unit of work ended", field, handle.getIdentity());
            return;
        }
        FieldAccessRecord record = handle.record();
        if (record == null) {
            return;
        }
        record.markRead(field);
    }

    /**
     * Records a field read by identity, attributing it to the group that most recently
     * materialized that identity.
     */
    public void onFieldRead(RecordIdentity identity, String field) {
        if (!active) {
            log.trace("Dropping read of '{}' on {}: unit of work ended", field, identity);
            return;
        }
        FieldAccessRecord record = latestByIdentity.get(identity);
        if (record == null) {
            log.debug("Dropping read of '{}' on unregistered record {}", field, identity);
            return;
        }
        record.markRead(field);
    }

    public Collection<FieldAccessRecord> getRecords(GroupId groupId) {
        Map<RecordIdentity, FieldAccessRecord> records = recordsByGroup.get(groupId);
        return records == null ? List.of() : List.copyOf(records.values());
    }

    public int getRecordCount(GroupId groupId) {
        Map<RecordIdentity, FieldAccessRecord> records = recordsByGroup.get(groupId);
        return records == null ? 0 : records.size();
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Stops tracking; later reads and registrations are ignored.
     */
    public void close() {
        active = false;
    }
}
