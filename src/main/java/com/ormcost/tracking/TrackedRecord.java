package com.ormcost.tracking;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A materialized row whose field reads are reported to the field access tracker.
 *
 * <p>Only {@link #get(String)} and the typed getters count as consumption; listing
 * {@link #getFieldNames()} does not.
 */
public final class TrackedRecord {

    private final RecordHandle handle;
    private final Map<String, Object> values;

    public TrackedRecord(RecordHandle handle, Map<String, ?> values) {
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String field) {
        handle.markRead(field);
        return values.get(field);
    }

    public String getString(String field) {
        Object value = get(field);
        return value == null ? null : value.toString();
    }

    public Long getLong(String field) {
        Object value = get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.valueOf(value.toString());
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    public Set<String> getFieldNames() {
        return values.keySet();
    }

    public RecordIdentity getIdentity() {
        return handle.getIdentity();
    }

    public RecordHandle getHandle() {
        return handle;
    }

    @Override
    public String toString() {
        return "TrackedRecord[" + handle.getIdentity() + "]";
    }
}
