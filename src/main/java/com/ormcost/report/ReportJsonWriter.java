package com.ormcost.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ormcost.capture.QueryEvent;
import com.ormcost.spi.OrmCostException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Serializes a report tree to JSON: unit of work, groups, queries and field sets.
 * Unknown field sets are written as the string {@code "unknown"}, never as an empty array.
 */
public class ReportJsonWriter {

    private final ObjectMapper objectMapper;

    public ReportJsonWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Returns the report as a JSON document.
     *
     * @throws OrmCostException if serialization fails
     */
    public String toJson(Report report) {
        try {
            return objectMapper.writeValueAsString(toTree(report));
        } catch (JsonProcessingException e) {
            throw new OrmCostException("Could not serialize report for " + report.contextId(), e);
        }
    }

    /**
     * Writes the report to a file.
     */
    public void writeTo(Report report, Path path) throws IOException {
        objectMapper.writeValue(path.toFile(), toTree(report));
    }

    public ObjectNode toTree(Report report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("contextId", report.contextId());
        putInstant(root, "startedAt", report.startedAt());
        putInstant(root, "endedAt", report.endedAt());
        putDuration(root, "executionTimeNanos", report.executionTime());
        root.put("queryCount", report.queryCount());
        root.put("totalDbTimeNanos", report.totalDbTime().toNanos());

        ArrayNode groups = root.putArray("groups");
        for (GroupReport group : report.groups()) {
            ObjectNode node = groups.addObject();
            node.put("sequence", group.id().sequence());
            node.put("origin", group.origin().location());
            if (group.primary().isPresent()) {
                node.set("primary", eventNode(group.primary().get()));
            } else {
                node.putNull("primary");
            }
            ArrayNode dependents = node.putArray("dependents");
            group.dependents().forEach(d -> dependents.add(eventNode(d)));
            putFields(node, "fetched", group.fetched());
            putFields(node, "consumed", group.consumed());
            putFields(node, "overFetched", group.overFetched());
            node.put("recordCount", group.recordCount());
        }

        ObjectNode duplicates = root.putObject("duplicates");
        report.duplicates().forEach(duplicates::put);

        ArrayNode warnings = root.putArray("warnings");
        for (ScopeWarning warning : report.warnings()) {
            ObjectNode node = warnings.addObject();
            node.put("kind", warning.kind().name());
            node.put("message", warning.message());
        }
        return root;
    }

    private ObjectNode eventNode(QueryEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("sequence", event.sequence());
        node.put("statement", event.statement());
        if (!event.parameters().isEmpty()) {
            ArrayNode params = node.putArray("parameters");
            event.parameters().forEach(p -> params.add(p == null ? null : p.toString()));
        }
        putInstant(node, "startedAt", event.startedAt());
        putDuration(node, "durationNanos", event.duration());
        node.put("origin", event.origin().location());
        if (!event.relationPath().isRoot()) {
            node.put("relation", event.relationPath().toString());
        }
        event.failure().ifPresent(f -> node.put("failure", f));
        return node;
    }

    private static void putFields(ObjectNode node, String name, FieldSet fields) {
        if (!fields.isKnown()) {
            node.put(name, "unknown");
            return;
        }
        ArrayNode array = node.putArray(name);
        fields.getFields().forEach(array::add);
    }

    private static void putInstant(ObjectNode node, String name, Optional<Instant> instant) {
        if (instant.isPresent()) {
            node.put(name, instant.get().toString());
        } else {
            node.putNull(name);
        }
    }

    private static void putDuration(ObjectNode node, String name, Optional<Duration> duration) {
        if (duration.isPresent()) {
            node.put(name, duration.get().toNanos());
        } else {
            node.putNull(name);
        }
    }
}
