package com.ormcost.grouping;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Chain of relationship names leading from a group's primary records to a dependent query,
 * e.g. {@code orders.items}. The root path belongs to the primary query.
 */
public record RelationPath(List<String> segments) {

    public static final RelationPath ROOT = new RelationPath(List.of());

    public RelationPath {
        Objects.requireNonNull(segments, "segments must not be null");
        segments = List.copyOf(segments);
    }

    public RelationPath child(String relation) {
        if (relation == null || relation.isBlank()) {
            throw new IllegalArgumentException("relation must not be blank");
        }
        List<String> extended = new ArrayList<>(segments);
        extended.add(relation);
        return new RelationPath(extended);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /**
     * Qualifies a field name with this path: {@code total} under {@code orders} becomes {@code orders.total}.
     */
    public String qualify(String field) {
        return isRoot() ? field : String.join(".", segments) + "." + field;
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
