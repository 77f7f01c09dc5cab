package com.ormcost.spi;

/**
 * Exception raised when a capture, correlation or tracking step fails.
 * Never escapes the engine: it is caught where it happens, logged, and the affected
 * event is recorded with degraded fields.
 */
public class InstrumentationException extends OrmCostException {

    private final String stage;

    public InstrumentationException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    /**
     * Returns the instrumentation stage that failed (capture, correlation, tracking).
     */
    public String getStage() {
        return stage;
    }
}
