package com.ormcost.grouping;

import com.ormcost.origin.Origin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Clusters the queries of one unit of work into groups.
 *
 * <p>Policy:
 * <ul>
 *   <li>A query started while no relationship scope is open opens a new group and closes the previous one.</li>
 *   <li>A query started inside a relationship scope becomes a dependent of the innermost scope's group,
 *       provided that group is still open.</li>
 *   <li>A scope whose group has already closed (the relationship was resolved lazily after another
 *       primary ran) does not make dependents; its queries open new groups.</li>
 * </ul>
 *
 * <p>One instance per unit of work; not thread-safe.
 */
public final class GroupingEngine {

    private static final Logger log = LoggerFactory.getLogger(GroupingEngine.class);

    private final List<QueryGroup> groups = new ArrayList<>();
    private final Map<GroupId, QueryGroup> groupsById = new HashMap<>();
    private final Deque<RelationshipScope> scopes = new ArrayDeque<>();
    private QueryGroup openGroup;
    private int querySequence;
    private int groupSequence;
    private boolean finished;

    /**
     * Places a query that is starting now.
     *
     * @param origin the resolved origin of the query
     * @return the assignment; opens a new group unless the query is a dependent
     */
    public GroupAssignment assignGroup(Origin origin) {
        Objects.requireNonNull(origin, "origin must not be null");
        if (finished) {
            throw new IllegalStateException("Grouping already finished");
        }
        int sequence = ++querySequence;

        RelationshipScope scope = scopes.peek();
        if (scope != null && scope.getGroup() != null) {
            if (scope.getGroup().isOpen()) {
                return new GroupAssignment(scope.getGroup(), sequence, scope.getPath(), false);
            }
            log.debug("Relationship '{}' resolved on closed group {}; query {} starts a new group",
                    scope.getPath(), scope.getGroup().getId(), sequence);
        }

        if (openGroup != null) {
            openGroup.close();
        }
        QueryGroup group = new QueryGroup(new GroupId(++groupSequence, origin));
        groups.add(group);
        groupsById.put(group.getId(), group);
        openGroup = group;
        return new GroupAssignment(group, sequence, RelationPath.ROOT, true);
    }

    /**
     * Opens a relationship scope on records produced by the given group at the given path.
     */
    public RelationshipScope openRelationship(GroupId sourceGroup, RelationPath sourcePath, String relation) {
        Objects.requireNonNull(sourcePath, "sourcePath must not be null");
        QueryGroup group = groupsById.get(sourceGroup);
        if (group == null) {
            log.debug("Relationship '{}' names unknown group {}; falling back to the enclosing scope",
                    relation, sourceGroup);
            return openRelationship(relation);
        }
        return push(group, sourcePath.child(relation));
    }

    /**
     * Opens a relationship scope whose source is implicit: the innermost open scope, or
     * else the most recently opened group.
     */
    public RelationshipScope openRelationship(String relation) {
        RelationshipScope enclosing = scopes.peek();
        if (enclosing != null && enclosing.getGroup() != null) {
            return push(enclosing.getGroup(), enclosing.getPath().child(relation));
        }
        if (openGroup != null) {
            return push(openGroup, RelationPath.ROOT.child(relation));
        }
        return push(null, RelationPath.ROOT.child(relation));
    }

    /**
     * Closes every group and open scope.
     *
     * @return the number of relationship scopes that were still open
     */
    public int finish() {
        int unbalanced = scopes.size();
        scopes.clear();
        for (QueryGroup group : groups) {
            group.close();
        }
        openGroup = null;
        finished = true;
        return unbalanced;
    }

    public List<QueryGroup> getGroups() {
        return List.copyOf(groups);
    }

    public Optional<QueryGroup> findGroup(GroupId id) {
        return Optional.ofNullable(groupsById.get(id));
    }

    public int getQueryCount() {
        return querySequence;
    }

    public int getOpenScopeCount() {
        return scopes.size();
    }

    void release(RelationshipScope scope) {
        if (finished) {
            return;
        }
        if (scopes.peek() == scope) {
            scopes.pop();
        } else if (scopes.remove(scope)) {
            log.warn("Relationship scope '{}' closed out of order", scope.getPath());
        }
    }

    private RelationshipScope push(QueryGroup group, RelationPath path) {
        if (finished) {
            return RelationshipScope.NOOP;
        }
        RelationshipScope scope = new RelationshipScope(this, group, path);
        scopes.push(scope);
        return scope;
    }
}
