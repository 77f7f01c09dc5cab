package com.ormcost.report;

import com.ormcost.capture.QueryEvent;
import com.ormcost.grouping.GroupId;
import com.ormcost.grouping.QueryGroup;
import com.ormcost.grouping.RelationPath;
import com.ormcost.origin.Origin;
import com.ormcost.tracking.FieldAccessTracker;
import com.ormcost.tracking.RecordHandle;
import com.ormcost.tracking.RecordIdentity;
import com.ormcost.tracking.TrackedRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.ormcost.util.TestDurations.micros;
import static org.assertj.core.api.Assertions.*;

/**
 * TDD Unit Tests for the per-group part of ReportAggregator.
 * Whole reports are covered through the engine in QueryCostEngineTest.
 */
@DisplayName("ReportAggregator")
class ReportAggregatorTest {

    private static final Origin ORIGIN = new Origin("UserController.java", 12, "com.example.UserController", "index");
    private static final GroupId GROUP = new GroupId(1, ORIGIN);
    private static final RelationPath ORDERS = RelationPath.ROOT.child("orders");

    private ReportAggregator aggregator;
    private FieldAccessTracker tracker;
    private QueryGroup group;

    @BeforeEach
    void setUp() {
        aggregator = new ReportAggregator();
        tracker = new FieldAccessTracker();
        group = new QueryGroup(GROUP);
    }

    @Nested
    @DisplayName("Fetched And Consumed")
    class FieldTests {

        @Test
        @DisplayName("should report declared columns never read as over-fetched")
        void toGroupReport_shouldComputeOverFetch() {
            QueryEvent users = event(1, RelationPath.ROOT, Optional.of(List.of("id", "name", "email")), null);
            group.attach(users);
            TrackedRecord user = new TrackedRecord(tracker.register(users, RecordIdentity.of("users", 1)),
                    Map.of("id", 1, "name", "Ada", "email", "ada@example.com"));
            user.get("name");

            GroupReport report = aggregator.toGroupReport(group, tracker);

            assertThat(report.fetched().getFields()).containsExactly("email", "id", "name");
            assertThat(report.consumed().getFields()).containsExactly("name");
            assertThat(report.overFetched().getFields()).containsExactly("email", "id");
            assertThat(report.recordCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should qualify dependent columns and reads by relation path")
        void toGroupReport_dependents_shouldQualifyFields() {
            QueryEvent users = event(1, RelationPath.ROOT, Optional.of(List.of("id", "total")), null);
            QueryEvent orders = event(2, ORDERS, Optional.of(List.of("id", "total")), null);
            group.attach(users);
            group.attach(orders);
            RecordHandle order = tracker.register(orders, RecordIdentity.of("orders", 10));
            tracker.onFieldRead(order, "total");

            GroupReport report = aggregator.toGroupReport(group, tracker);

            assertThat(report.fetched().getFields()).containsExactly("id", "orders.id", "orders.total", "total");
            assertThat(report.consumed().getFields()).containsExactly("orders.total");
            assertThat(report.overFetched().getFields()).containsExactly("id", "orders.id", "total");
        }

        @Test
        @DisplayName("should report fetched and over-fetched as unknown when columns were not declared")
        void toGroupReport_unknownColumns_shouldBeUnknown() {
            QueryEvent users = event(1, RelationPath.ROOT, Optional.empty(), null);
            group.attach(users);
            tracker.onFieldRead(tracker.register(users, RecordIdentity.of("users", 1)), "name");

            GroupReport report = aggregator.toGroupReport(group, tracker);

            assertThat(report.fetched().isKnown()).isFalse();
            assertThat(report.overFetched().isKnown()).isFalse();
            assertThat(report.consumed().getFields()).containsExactly("name");
        }

        @Test
        @DisplayName("should ignore failed queries when computing fetched fields")
        void fetchedFields_failedDependent_shouldBeSkipped() {
            List<QueryEvent> events = List.of(
                    event(1, RelationPath.ROOT, Optional.of(List.of("id")), null),
                    event(2, ORDERS, Optional.empty(), "SQLException: timeout")
            );

            FieldSet fetched = ReportAggregator.fetchedFields(events);

            assertThat(fetched.getFields()).containsExactly("id");
        }

        @Test
        @DisplayName("should report nothing consumed for a group whose records were never read")
        void consumedFields_noReads_shouldBeEmpty() {
            QueryEvent users = event(1, RelationPath.ROOT, Optional.of(List.of("id")), null);
            group.attach(users);
            tracker.register(users, RecordIdentity.of("users", 1));

            GroupReport report = aggregator.toGroupReport(group, tracker);

            assertThat(report.consumed()).isEqualTo(FieldSet.empty());
            assertThat(report.overFetched().getFields()).containsExactly("id");
        }
    }

    @Nested
    @DisplayName("Group Totals")
    class TotalTests {

        @Test
        @DisplayName("should sum member durations, counting untimed queries as zero")
        void dbTime_shouldSumDurations() {
            group.attach(timedEvent(1, RelationPath.ROOT, micros(300)));
            group.attach(timedEvent(2, ORDERS, micros(200)));
            group.attach(event(3, ORDERS, Optional.of(List.of("id")), null));

            GroupReport report = aggregator.toGroupReport(group, tracker);

            assertThat(report.queryCount()).isEqualTo(3);
            assertThat(report.dbTime()).isEqualTo(micros(500));
            assertThat(report.events()).extracting(QueryEvent::sequence).containsExactly(1, 2, 3);
            assertThat(report.origin()).isEqualTo(ORIGIN);
        }
    }

    private static QueryEvent event(int sequence, RelationPath path, Optional<List<String>> columns, String failure) {
        return new QueryEvent("uow", "ctx", sequence, "SELECT * FROM t" + sequence, List.of(),
                Optional.empty(), Optional.empty(), ORIGIN, GROUP, path, path.isRoot(),
                columns, Optional.ofNullable(failure));
    }

    private static QueryEvent timedEvent(int sequence, RelationPath path, Duration duration) {
        return new QueryEvent("uow", "ctx", sequence, "SELECT * FROM t" + sequence, List.of(),
                Optional.empty(), Optional.of(duration), ORIGIN, GROUP, path, path.isRoot(),
                Optional.of(List.of("id")), Optional.empty());
    }
}
