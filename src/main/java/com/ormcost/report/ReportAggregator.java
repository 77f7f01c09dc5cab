package com.ormcost.report;

import com.ormcost.capture.QueryEvent;
import com.ormcost.engine.UnitOfWork;
import com.ormcost.grouping.QueryGroup;
import com.ormcost.tracking.FieldAccessRecord;
import com.ormcost.tracking.FieldAccessTracker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Assembles the report tree of a finished unit of work.
 *
 * <p>Fetched fields come from the columns the integration layer declared for each query, never
 * from parsing statement text. Dependent columns and reads on dependent records are qualified by
 * relation path, so {@code orders.total} and a primary's {@code total} stay distinct.
 */
public final class ReportAggregator {

    /**
     * Builds the report. Called once, after the unit of work stopped recording.
     */
    public Report finalizeReport(UnitOfWork unitOfWork) {
        FieldAccessTracker tracker = unitOfWork.getTracker();
        List<GroupReport> groups = new ArrayList<>();
        Map<String, Integer> statementCounts = new LinkedHashMap<>();

        for (QueryGroup group : unitOfWork.getGroups()) {
            if (group.getQueryCount() == 0) {
                continue;
            }
            groups.add(toGroupReport(group, tracker));
            for (QueryEvent event : group.getEvents()) {
                statementCounts.merge(event.normalizedStatement(), 1, Integer::sum);
            }
        }

        Map<String, Integer> duplicates = new LinkedHashMap<>();
        statementCounts.forEach((statement, count) -> {
            if (count > 1) {
                duplicates.put(statement, count);
            }
        });

        return new Report(
                unitOfWork.getContextId(),
                unitOfWork.getStartedAt(),
                unitOfWork.getEndedAt(),
                unitOfWork.getExecutionTime(),
                groups,
                duplicates,
                unitOfWork.getWarnings()
        );
    }

    GroupReport toGroupReport(QueryGroup group, FieldAccessTracker tracker) {
        FieldSet fetched = fetchedFields(group.getEvents());
        FieldSet consumed = consumedFields(tracker.getRecords(group.getId()));
        return new GroupReport(
                group.getId(),
                group.getPrimary(),
                group.getDependents(),
                fetched,
                consumed,
                fetched.minus(consumed),
                tracker.getRecordCount(group.getId())
        );
    }

    static FieldSet fetchedFields(List<QueryEvent> events) {
        TreeSet<String> fields = new TreeSet<>();
        for (QueryEvent event : events) {
            if (event.declaredColumns().isEmpty()) {
                if (event.isFailed()) {
                    // a failed round-trip returned nothing, so it fetched nothing
                    continue;
                }
                return FieldSet.UNKNOWN;
            }
            for (String column : event.declaredColumns().get()) {
                fields.add(event.relationPath().qualify(column));
            }
        }
        return FieldSet.of(fields);
    }

    static FieldSet consumedFields(Iterable<FieldAccessRecord> records) {
        TreeSet<String> fields = new TreeSet<>();
        for (FieldAccessRecord record : records) {
            for (String field : record.getFieldsRead()) {
                fields.add(record.getRelationPath().qualify(field));
            }
        }
        return FieldSet.of(fields);
    }
}
