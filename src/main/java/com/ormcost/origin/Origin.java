package com.ormcost.origin;

import java.util.Objects;

/**
 * Source location of the application statement that forced a query.
 *
 * @param file       source file name, or {@value #UNKNOWN_FILE}
 * @param line       line number, or 0 when unknown
 * @param className  declaring class of the frame, empty when unattributed
 * @param methodName method of the frame, empty when unattributed
 */
public record Origin(String file, int line, String className, String methodName) {

    public static final String UNKNOWN_FILE = "unknown";

    /**
     * Marker for a query whose stack held no application frame.
     */
    public static final Origin UNATTRIBUTED = new Origin(UNKNOWN_FILE, 0, "", "");

    public Origin {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(className, "className must not be null");
        Objects.requireNonNull(methodName, "methodName must not be null");
    }

    public boolean isAttributed() {
        return !UNATTRIBUTED.equals(this);
    }

    /**
     * Returns {@code File.java:42}, or {@code unattributed}.
     */
    public String location() {
        if (!isAttributed()) {
            return "unattributed";
        }
        return line > 0 ? file + ":" + line : file;
    }

    @Override
    public String toString() {
        return location();
    }
}
