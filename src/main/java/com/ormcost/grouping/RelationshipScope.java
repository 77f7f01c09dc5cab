package com.ormcost.grouping;

/**
 * Open while the record layer resolves a relationship; queries started inside it are
 * classified as dependents of the scope's group.
 *
 * <p>Use with try-with-resources. Closing twice is harmless.
 */
public final class RelationshipScope implements AutoCloseable {

    /**
     * Scope handed out when no unit of work is active.
     */
    public static final RelationshipScope NOOP = new RelationshipScope(null, null, RelationPath.ROOT);

    private final GroupingEngine owner;
    private final QueryGroup group;
    private final RelationPath path;
    private boolean closed;

    RelationshipScope(GroupingEngine owner, QueryGroup group, RelationPath path) {
        this.owner = owner;
        this.group = group;
        this.path = path;
    }

    /**
     * Returns the group dependents attach to, or {@code null} when the scope has no source group.
     */
    public QueryGroup getGroup() {
        return group;
    }

    public RelationPath getPath() {
        return path;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (owner != null) {
            owner.release(this);
        }
    }
}
