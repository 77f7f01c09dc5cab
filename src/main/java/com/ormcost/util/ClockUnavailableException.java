package com.ormcost.util;

import com.ormcost.spi.InstrumentationException;

/**
 * Thrown by a {@link TimeSource} read when the clock cannot be read.
 */
public class ClockUnavailableException extends InstrumentationException {

    public static final String STAGE = "timing";

    public ClockUnavailableException(String message) {
        super(STAGE, message, null);
    }
}
