package com.ormcost.grouping;

import com.ormcost.origin.Origin;

import java.util.Objects;

/**
 * Identity of a query group: the origin of its primary query plus a sequence number.
 * The same source line executed in a loop yields distinct ids.
 */
public record GroupId(int sequence, Origin origin) implements Comparable<GroupId> {

    /**
     * Group reference for events captured outside any unit of work.
     */
    public static final GroupId DETACHED = new GroupId(0, Origin.UNATTRIBUTED);

    public GroupId {
        Objects.requireNonNull(origin, "origin must not be null");
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must not be negative: " + sequence);
        }
    }

    public boolean isDetached() {
        return sequence == 0;
    }

    @Override
    public int compareTo(GroupId other) {
        return Integer.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return "#" + sequence + " " + origin.location();
    }
}
