package com.ormcost.tracking;

import java.util.Objects;

/**
 * Identity of a materialized record: its shape (table, collection or class) and primary key,
 * or the object instance itself when no key is available.
 */
public record RecordIdentity(String shape, Object key) {

    public RecordIdentity {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(key, "key must not be null");
    }

    public static RecordIdentity of(String shape, Object primaryKey) {
        return new RecordIdentity(shape, primaryKey);
    }

    /**
     * Identity based on object identity rather than equality.
     */
    public static RecordIdentity ofInstance(String shape, Object instance) {
        return new RecordIdentity(shape, new InstanceKey(instance));
    }

    public boolean isInstanceBased() {
        return key instanceof InstanceKey;
    }

    @Override
    public String toString() {
        return shape + "[" + key + "]";
    }

    private static final class InstanceKey {
        private final Object instance;

        InstanceKey(Object instance) {
            this.instance = Objects.requireNonNull(instance, "instance must not be null");
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof InstanceKey that && that.instance == instance;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(instance);
        }

        @Override
        public String toString() {
            return "@" + Integer.toHexString(hashCode());
        }
    }
}
