package com.ormcost.report;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.ormcost.capture.QueryEvent;
import com.ormcost.grouping.GroupId;
import com.ormcost.grouping.RelationPath;
import com.ormcost.origin.Origin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.ormcost.util.TestDurations.micros;
import static org.assertj.core.api.Assertions.*;

@DisplayName("ReportLogger")
class ReportLoggerTest {

    private static final Origin ORIGIN = new Origin("UserController.java", 12, "com.example.UserController", "index");

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;
    private ReportLogger reportLogger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(ReportLogger.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
        reportLogger = new ReportLogger();
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setLevel(null);
        logger.setAdditive(true);
    }

    @Test
    @DisplayName("should log totals at INFO and each query at DEBUG")
    void log_shouldWriteTotalsAndQueries() {
        reportLogger.log(report(FieldSet.of("name"), Map.of(), List.of()));

        assertThat(messages(Level.INFO)).singleElement().asString()
                .contains("request-1")
                .contains("1 queries in 1 groups")
                .contains("0.30 ms");
        assertThat(messages(Level.DEBUG)).singleElement().asString()
                .contains("UserController.java:12")
                .contains("primary")
                .contains("SELECT id, name, email FROM users");
    }

    @Test
    @DisplayName("should warn about over-fetched fields, repeated statements and scope warnings")
    void log_shouldWarnAboutWaste() {
        reportLogger.log(report(FieldSet.of("name"), Map.of("SELECT 1", 3),
                List.of(new ScopeWarning(ScopeWarning.Kind.UNMATCHED_END, "request-1", "no active unit of work"))));

        assertThat(messages(Level.WARN))
                .anySatisfy(m -> assertThat(m).contains("Repeated 3x").contains("SELECT 1"))
                .anySatisfy(m -> assertThat(m).contains("never read").contains("[email, id]"))
                .anySatisfy(m -> assertThat(m).contains("UNMATCHED_END"));
    }

    @Test
    @DisplayName("should not warn when every fetched field was read")
    void log_noWaste_shouldNotWarn() {
        reportLogger.log(report(FieldSet.of("id", "name", "email"), Map.of(), List.of()));

        assertThat(messages(Level.WARN)).isEmpty();
    }

    @Test
    @DisplayName("should shorten long statements in previews")
    void preview_shouldTruncateLongStatements() {
        String statement = "SELECT " + "x, ".repeat(100) + "y FROM t";

        String preview = ReportLogger.preview(statement);

        assertThat(preview).hasSize(ReportLogger.STATEMENT_PREVIEW + 3).endsWith("...");
        assertThat(ReportLogger.preview("SELECT 1")).isEqualTo("SELECT 1");
    }

    private List<String> messages(Level level) {
        return logAppender.list.stream()
                .filter(e -> e.getLevel() == level)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    private static Report report(FieldSet consumed, Map<String, Integer> duplicates, List<ScopeWarning> warnings) {
        GroupId id = new GroupId(1, ORIGIN);
        QueryEvent primary = new QueryEvent("uow", "request-1", 1, "SELECT id, name, email FROM users",
                List.of(), Optional.empty(), Optional.of(micros(300)), ORIGIN, id, RelationPath.ROOT, true,
                Optional.of(List.of("id", "name", "email")), Optional.empty());
        FieldSet fetched = FieldSet.of("id", "name", "email");
        GroupReport group = new GroupReport(id, Optional.of(primary), List.of(),
                fetched, consumed, fetched.minus(consumed), 1);
        return new Report("request-1", Optional.empty(), Optional.empty(), Optional.empty(),
                List.of(group), duplicates, warnings);
    }
}
