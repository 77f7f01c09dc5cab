package com.ormcost.report;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A set of field names that may be unknown.
 *
 * <p>Unknown is distinct from empty: a query whose output columns were never declared has an
 * unknown fetched set, and anything derived from it is unknown too, so that no field is
 * reported as over-fetched on a guess.
 */
public final class FieldSet {

    public static final FieldSet UNKNOWN = new FieldSet(null);

    private static final FieldSet EMPTY = new FieldSet(new TreeSet<>());

    private final SortedSet<String> fields;

    private FieldSet(SortedSet<String> fields) {
        this.fields = fields == null ? null : Collections.unmodifiableSortedSet(fields);
    }

    public static FieldSet of(Collection<String> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        return new FieldSet(new TreeSet<>(fields));
    }

    public static FieldSet of(String... fields) {
        return of(Arrays.asList(fields));
    }

    public static FieldSet empty() {
        return EMPTY;
    }

    public boolean isKnown() {
        return fields != null;
    }

    /**
     * Returns the field names in sorted order.
     *
     * @throws IllegalStateException if the set is unknown
     */
    public SortedSet<String> getFields() {
        if (fields == null) {
            throw new IllegalStateException("Field set is unknown");
        }
        return fields;
    }

    public boolean contains(String field) {
        return fields != null && fields.contains(field);
    }

    public int size() {
        return fields == null ? 0 : fields.size();
    }

    public FieldSet union(FieldSet other) {
        if (!isKnown() || !other.isKnown()) {
            return UNKNOWN;
        }
        SortedSet<String> merged = new TreeSet<>(fields);
        merged.addAll(other.fields);
        return new FieldSet(merged);
    }

    /**
     * Returns the fields of this set that are absent from {@code other}.
     */
    public FieldSet minus(FieldSet other) {
        if (!isKnown() || !other.isKnown()) {
            return UNKNOWN;
        }
        SortedSet<String> remaining = new TreeSet<>(fields);
        remaining.removeAll(other.fields);
        return new FieldSet(remaining);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldSet other)) return false;
        return Objects.equals(fields, other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(fields);
    }

    @Override
    public String toString() {
        return fields == null ? "unknown" : fields.toString();
    }
}
