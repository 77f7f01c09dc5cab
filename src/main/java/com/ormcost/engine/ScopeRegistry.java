package com.ormcost.engine;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide map of execution context to its active unit of work.
 * The only engine structure shared across threads.
 */
final class ScopeRegistry {

    private final Map<String, UnitOfWork> active = new ConcurrentHashMap<>();

    /**
     * Registers the unit of work unless its context already has one.
     *
     * @return the unit of work already active for the context, or empty if registration succeeded
     */
    Optional<UnitOfWork> register(UnitOfWork unitOfWork) {
        Objects.requireNonNull(unitOfWork, "unitOfWork must not be null");
        return Optional.ofNullable(active.putIfAbsent(unitOfWork.getContextId(), unitOfWork));
    }

    /**
     * Returns the active unit of work of the context; empty for a {@code null} context.
     */
    Optional<UnitOfWork> find(String contextId) {
        if (contextId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(active.get(contextId));
    }

    /**
     * Removes the association if it still points at this unit of work.
     */
    boolean release(UnitOfWork unitOfWork) {
        return active.remove(unitOfWork.getContextId(), unitOfWork);
    }

    int size() {
        return active.size();
    }
}
