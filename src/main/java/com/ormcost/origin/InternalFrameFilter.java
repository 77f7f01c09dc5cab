package com.ormcost.origin;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a stack frame belongs to framework or library internals.
 *
 * <p>Each entry is either a package prefix ending in {@code '.'} (matches every class in
 * that package subtree) or a fully qualified class name (matches the class and its nested
 * classes).
 */
public final class InternalFrameFilter {

    private final List<String> prefixes;

    public InternalFrameFilter(List<String> prefixes) {
        Objects.requireNonNull(prefixes, "prefixes must not be null");
        this.prefixes = List.copyOf(prefixes);
    }

    public boolean isInternal(String className) {
        if (className == null) {
            return true;
        }
        for (String prefix : prefixes) {
            if (prefix.endsWith(".")) {
                if (className.startsWith(prefix)) {
                    return true;
                }
            } else if (className.equals(prefix) || className.startsWith(prefix + "$")) {
                return true;
            }
        }
        return false;
    }

    public List<String> getPrefixes() {
        return prefixes;
    }
}
