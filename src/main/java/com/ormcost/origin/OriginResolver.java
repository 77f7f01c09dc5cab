package com.ormcost.origin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the application call site that forced a deferred query.
 *
 * <p>Must be called synchronously at the moment the query is forced: the stack is read
 * innermost frame first, internal frames are skipped, and the first remaining frame
 * becomes the origin.
 */
public final class OriginResolver {

    private static final Logger log = LoggerFactory.getLogger(OriginResolver.class);

    private final InternalFrameFilter filter;
    private final StackWalker walker;

    public OriginResolver(InternalFrameFilter filter) {
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
        this.walker = StackWalker.getInstance();
    }

    /**
     * Resolves the origin from the current thread's stack.
     *
     * @return the nearest application frame, or {@link Origin#UNATTRIBUTED}
     */
    public Origin resolve() {
        try {
            Optional<StackWalker.StackFrame> frame = walker.walk(frames -> frames
                    .filter(f -> !filter.isInternal(f.getClassName()))
                    .findFirst());
            return frame.map(f -> toOrigin(f.getFileName(), f.getLineNumber(), f.getClassName(), f.getMethodName()))
                    .orElse(Origin.UNATTRIBUTED);
        } catch (RuntimeException e) {
            log.warn("Could not walk the stack to resolve a query origin", e);
            return Origin.UNATTRIBUTED;
        }
    }

    /**
     * Resolves the origin from a stack captured earlier, innermost frame first.
     */
    public Origin resolve(List<StackTraceElement> stack) {
        for (StackTraceElement element : stack) {
            if (!filter.isInternal(element.getClassName())) {
                return toOrigin(element.getFileName(), element.getLineNumber(),
                        element.getClassName(), element.getMethodName());
            }
        }
        return Origin.UNATTRIBUTED;
    }

    private static Origin toOrigin(String fileName, int lineNumber, String className, String methodName) {
        return new Origin(
                fileName != null ? fileName : Origin.UNKNOWN_FILE,
                Math.max(lineNumber, 0),
                className,
                methodName != null ? methodName : ""
        );
    }
}
