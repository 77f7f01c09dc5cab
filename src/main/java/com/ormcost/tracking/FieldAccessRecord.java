package com.ormcost.tracking;

import com.ormcost.grouping.GroupId;
import com.ormcost.grouping.RelationPath;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fields read on one materialized record, keyed by group and record identity.
 * Consumption is set membership; per-field counts are kept for diagnostics.
 */
public final class FieldAccessRecord {

    private final GroupId groupId;
    private final RecordIdentity identity;
    private final RelationPath relationPath;
    private final Map<String, Integer> readCounts = new LinkedHashMap<>();

    FieldAccessRecord(GroupId groupId, RecordIdentity identity, RelationPath relationPath) {
        this.groupId = groupId;
        this.identity = identity;
        this.relationPath = relationPath;
    }

    void markRead(String field) {
        readCounts.merge(field, 1, Integer::sum);
    }

    public GroupId getGroupId() {
        return groupId;
    }

    public RecordIdentity getIdentity() {
        return identity;
    }

    public RelationPath getRelationPath() {
        return relationPath;
    }

    public Set<String> getFieldsRead() {
        return Collections.unmodifiableSet(readCounts.keySet());
    }

    public int getReadCount(String field) {
        return readCounts.getOrDefault(field, 0);
    }
}
