package com.ormcost.grouping;

import java.util.Objects;

/**
 * Where a starting query was placed: its group, its position in the unit of work,
 * and whether it opened the group or depends on it.
 *
 * @param group        the owning group, {@code null} only for detached queries
 * @param sequence     start order within the unit of work, 1-based
 * @param relationPath relationship path of a dependent, {@link RelationPath#ROOT} for a primary
 * @param primary      true when the query opened the group
 */
public record GroupAssignment(QueryGroup group, int sequence, RelationPath relationPath, boolean primary) {

    public GroupAssignment {
        Objects.requireNonNull(relationPath, "relationPath must not be null");
    }

    public static GroupAssignment detached() {
        return new GroupAssignment(null, 0, RelationPath.ROOT, true);
    }

    public boolean isDetached() {
        return group == null;
    }

    public GroupId groupId() {
        return group != null ? group.getId() : GroupId.DETACHED;
    }
}
