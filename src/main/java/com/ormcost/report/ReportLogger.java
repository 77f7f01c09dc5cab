package com.ormcost.report;

import com.ormcost.capture.QueryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Writes a short summary of a report to the log: totals at INFO, one line per query at DEBUG,
 * repeated statements, over-fetching and scope warnings at WARN.
 */
public final class ReportLogger {

    private static final Logger log = LoggerFactory.getLogger(ReportLogger.class);

    static final int STATEMENT_PREVIEW = 100;

    public void log(Report report) {
        log.info("Query cost for {}: {} queries in {} groups, db time {} ms, execution time {}",
                report.contextId(),
                report.queryCount(),
                report.groups().size(),
                millis(report.totalDbTime()),
                report.executionTime().map(d -> millis(d) + " ms").orElse("unknown"));

        if (log.isDebugEnabled()) {
            for (QueryEvent event : report.events()) {
                log.debug("{}. [{}] {} ({}) {}",
                        event.sequence(),
                        event.origin().location(),
                        event.duration().map(d -> millis(d) + " ms").orElse("untimed"),
                        event.primary() ? "primary" : "dependent " + event.relationPath(),
                        preview(event.statement()));
            }
        }

        report.duplicates().forEach((statement, count) ->
                log.warn("Repeated {}x: {}", count, preview(statement)));

        for (GroupReport group : report.groups()) {
            if (group.overFetched().isKnown() && group.overFetched().size() > 0) {
                log.warn("Group {} fetched but never read: {}", group.id(), group.overFetched());
            }
        }

        for (ScopeWarning warning : report.warnings()) {
            log.warn("{} in {}: {}", warning.kind(), warning.contextId(), warning.message());
        }
    }

    static String preview(String statement) {
        return statement.length() <= STATEMENT_PREVIEW
                ? statement
                : statement.substring(0, STATEMENT_PREVIEW) + "...";
    }

    private static String millis(Duration duration) {
        return String.format(Locale.ROOT, "%.2f", duration.toNanos() / 1_000_000.0);
    }
}
