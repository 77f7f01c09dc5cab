package com.ormcost.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ormcost.capture.QueryEvent;
import com.ormcost.grouping.GroupId;
import com.ormcost.grouping.RelationPath;
import com.ormcost.origin.Origin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.ormcost.util.TestDurations.micros;
import static com.ormcost.util.TestDurations.millis;
import static org.assertj.core.api.Assertions.*;

@DisplayName("ReportJsonWriter")
class ReportJsonWriterTest {

    private static final Origin ORIGIN = new Origin("UserController.java", 12, "com.example.UserController", "index");
    private static final GroupId GROUP = new GroupId(1, ORIGIN);
    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private ReportJsonWriter writer;
    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        writer = new ReportJsonWriter();
        mapper = new ObjectMapper();
    }

    @Test
    @DisplayName("should write groups with their queries and field sets")
    void toJson_shouldWriteReportTree() throws Exception {
        JsonNode root = mapper.readTree(writer.toJson(sampleReport()));

        assertThat(root.get("contextId").asText()).isEqualTo("request-1");
        assertThat(root.get("startedAt").asText()).isEqualTo("2024-03-01T10:00:00Z");
        assertThat(root.get("executionTimeNanos").asLong()).isEqualTo(millis(5).toNanos());
        assertThat(root.get("queryCount").asInt()).isEqualTo(2);
        assertThat(root.get("totalDbTimeNanos").asLong()).isEqualTo(micros(500).toNanos());

        JsonNode group = root.get("groups").get(0);
        assertThat(group.get("origin").asText()).isEqualTo("UserController.java:12");
        assertThat(group.get("primary").get("statement").asText()).isEqualTo("SELECT id, name, email FROM users");
        assertThat(group.get("dependents").get(0).get("relation").asText()).isEqualTo("orders");
        assertThat(group.get("fetched")).extracting(JsonNode::asText)
                .containsExactly("email", "id", "name", "orders.id");
        assertThat(group.get("overFetched")).extracting(JsonNode::asText)
                .containsExactly("email", "id", "orders.id");
        assertThat(group.get("recordCount").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("should write unknown field sets as a string, not an empty array")
    void toJson_unknownFields_shouldWriteUnknown() throws Exception {
        GroupReport unknownGroup = new GroupReport(GROUP, Optional.of(primary()), List.of(),
                FieldSet.UNKNOWN, FieldSet.of("name"), FieldSet.UNKNOWN, 1);
        Report report = new Report("request-1", Optional.empty(), Optional.empty(), Optional.empty(),
                List.of(unknownGroup), Map.of(), List.of());

        JsonNode group = mapper.readTree(writer.toJson(report)).get("groups").get(0);

        assertThat(group.get("fetched").asText()).isEqualTo("unknown");
        assertThat(group.get("overFetched").asText()).isEqualTo("unknown");
        assertThat(group.get("consumed").isArray()).isTrue();
    }

    @Test
    @DisplayName("should write missing timing as null")
    void toJson_missingTiming_shouldWriteNull() throws Exception {
        Report report = new Report("request-1", Optional.empty(), Optional.empty(), Optional.empty(),
                List.of(), Map.of(), List.of());

        JsonNode root = mapper.readTree(writer.toJson(report));

        assertThat(root.get("startedAt").isNull()).isTrue();
        assertThat(root.get("executionTimeNanos").isNull()).isTrue();
        assertThat(root.get("groups")).isEmpty();
    }

    @Test
    @DisplayName("should write duplicates and warnings")
    void toJson_shouldWriteDuplicatesAndWarnings() throws Exception {
        Report report = new Report("request-1", Optional.empty(), Optional.empty(), Optional.empty(),
                List.of(), Map.of("SELECT 1", 3),
                List.of(new ScopeWarning(ScopeWarning.Kind.NESTED_BEGIN, "request-1", "already active")));

        JsonNode root = mapper.readTree(writer.toJson(report));

        assertThat(root.get("duplicates").get("SELECT 1").asInt()).isEqualTo(3);
        assertThat(root.get("warnings").get(0).get("kind").asText()).isEqualTo("NESTED_BEGIN");
    }

    @Test
    @DisplayName("should write the report to a file")
    void writeTo_shouldWriteFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("report.json");

        writer.writeTo(sampleReport(), file);

        assertThat(mapper.readTree(Files.readString(file)).get("contextId").asText()).isEqualTo("request-1");
    }

    private static Report sampleReport() {
        QueryEvent orders = new QueryEvent("uow", "request-1", 2, "SELECT id FROM orders WHERE user_id = ?",
                List.of(), Optional.of(START), Optional.of(micros(200)), ORIGIN, GROUP,
                RelationPath.ROOT.child("orders"), false, Optional.of(List.of("id")), Optional.empty());
        FieldSet fetched = FieldSet.of("email", "id", "name", "orders.id");
        FieldSet consumed = FieldSet.of("name");
        GroupReport group = new GroupReport(GROUP, Optional.of(primary()), List.of(orders),
                fetched, consumed, fetched.minus(consumed), 1);
        return new Report("request-1", Optional.of(START), Optional.of(START.plusMillis(5)),
                Optional.of(millis(5)), List.of(group), Map.of(), List.of());
    }

    private static QueryEvent primary() {
        return new QueryEvent("uow", "request-1", 1, "SELECT id, name, email FROM users",
                List.of(), Optional.of(START), Optional.of(micros(300)), ORIGIN, GROUP,
                RelationPath.ROOT, true, Optional.of(List.of("id", "name", "email")), Optional.empty());
    }
}
