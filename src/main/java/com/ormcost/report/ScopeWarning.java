package com.ormcost.report;

import java.util.Objects;

/**
 * A unit-of-work scope violation, reported in the report instead of being thrown.
 */
public record ScopeWarning(Kind kind, String contextId, String message) {

    public enum Kind {
        /** begin called while a unit of work was already active for the context */
        NESTED_BEGIN,
        /** end called with no matching begin */
        UNMATCHED_END,
        /** the unit of work ended with relationship scopes still open */
        UNBALANCED_RELATIONSHIP,
        /** queries started but never ended */
        INCOMPLETE_QUERY
    }

    public ScopeWarning {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(contextId, "contextId must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
