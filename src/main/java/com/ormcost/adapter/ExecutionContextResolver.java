package com.ormcost.adapter;

/**
 * Supplies the execution-context id for hooks invoked from inside a data layer, where the
 * caller cannot pass it explicitly.
 */
@FunctionalInterface
public interface ExecutionContextResolver {

    /**
     * Returns the id of the execution context the current call belongs to.
     */
    String currentContextId();

    /**
     * One context per thread, for thread-per-request hosts.
     */
    static ExecutionContextResolver perThread() {
        return () -> "thread-" + Thread.currentThread().getId();
    }

    /**
     * A single fixed context.
     */
    static ExecutionContextResolver fixed(String contextId) {
        return () -> contextId;
    }
}
