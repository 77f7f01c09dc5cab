package com.ormcost.report;

import com.ormcost.capture.QueryEvent;
import com.ormcost.grouping.GroupId;
import com.ormcost.origin.Origin;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Report entry for one query group.
 *
 * @param id          group identity
 * @param primary     the primary query; empty only if it never completed
 * @param dependents  dependent queries in start order
 * @param fetched     declared columns of every member query, dependent columns qualified by relation path
 * @param consumed    fields read on the group's records, qualified the same way
 * @param overFetched fetched minus consumed
 * @param recordCount records registered for field tracking
 */
public record GroupReport(
        GroupId id,
        Optional<QueryEvent> primary,
        List<QueryEvent> dependents,
        FieldSet fetched,
        FieldSet consumed,
        FieldSet overFetched,
        int recordCount
) {

    public GroupReport {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(primary, "primary must not be null");
        Objects.requireNonNull(dependents, "dependents must not be null");
        Objects.requireNonNull(fetched, "fetched must not be null");
        Objects.requireNonNull(consumed, "consumed must not be null");
        Objects.requireNonNull(overFetched, "overFetched must not be null");
        dependents = List.copyOf(dependents);
    }

    public Origin origin() {
        return id.origin();
    }

    public List<QueryEvent> events() {
        List<QueryEvent> events = new ArrayList<>(dependents.size() + 1);
        primary.ifPresent(events::add);
        events.addAll(dependents);
        return events;
    }

    public int queryCount() {
        return dependents.size() + (primary.isPresent() ? 1 : 0);
    }

    /**
     * Sum of the measured durations of the group's queries; untimed queries count as zero.
     */
    public Duration dbTime() {
        return events().stream()
                .map(e -> e.duration().orElse(Duration.ZERO))
                .reduce(Duration.ZERO, Duration::plus);
    }
}
