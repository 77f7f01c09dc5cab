package com.ormcost.grouping;

import com.ormcost.capture.QueryEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One logical data-access operation: a primary query and the dependent queries fired while
 * resolving relationships on its records.
 *
 * <p>Not thread-safe; a group is only touched from the execution context of its unit of work.
 */
public final class QueryGroup {

    private final GroupId id;
    private QueryEvent primary;
    private final List<QueryEvent> dependents = new ArrayList<>();
    private boolean open = true;

    public QueryGroup(GroupId id) {
        this.id = Objects.requireNonNull(id, "id must not be null");
    }

    public GroupId getId() {
        return id;
    }

    /**
     * Adds a completed event to this group. Events may complete out of start order;
     * dependents are returned sorted by start sequence.
     */
    public void attach(QueryEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (!id.equals(event.groupId())) {
            throw new IllegalArgumentException("Event " + event.sequence() + " belongs to group "
                    + event.groupId() + ", not " + id);
        }
        if (event.primary()) {
            if (primary != null) {
                throw new IllegalStateException("Group " + id + " already has a primary query");
            }
            primary = event;
        } else {
            dependents.add(event);
        }
    }

    /**
     * Adds the time of a follow-up round-trip to the completed event with the given sequence.
     *
     * @return false if no such event is attached to this group
     */
    public boolean extend(int sequence, Duration roundTrip) {
        if (primary != null && primary.sequence() == sequence) {
            primary = primary.extendedBy(roundTrip);
            return true;
        }
        for (int i = 0; i < dependents.size(); i++) {
            QueryEvent dependent = dependents.get(i);
            if (dependent.sequence() == sequence) {
                dependents.set(i, dependent.extendedBy(roundTrip));
                return true;
            }
        }
        return false;
    }

    public Optional<QueryEvent> getPrimary() {
        return Optional.ofNullable(primary);
    }

    public List<QueryEvent> getDependents() {
        List<QueryEvent> sorted = new ArrayList<>(dependents);
        sorted.sort(Comparator.comparingInt(QueryEvent::sequence));
        return List.copyOf(sorted);
    }

    /**
     * Returns the primary (if completed) followed by the dependents in start order.
     */
    public List<QueryEvent> getEvents() {
        List<QueryEvent> events = new ArrayList<>(dependents.size() + 1);
        if (primary != null) {
            events.add(primary);
        }
        events.addAll(getDependents());
        return events;
    }

    public int getQueryCount() {
        return dependents.size() + (primary != null ? 1 : 0);
    }

    public boolean isOpen() {
        return open;
    }

    void close() {
        open = false;
    }

    @Override
    public String toString() {
        return "QueryGroup[" + id + ", queries=" + getQueryCount() + (open ? ", open" : "") + "]";
    }
}
