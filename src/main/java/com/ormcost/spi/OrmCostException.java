package com.ormcost.spi;

/**
 * Base exception for OrmCost errors.
 */
public class OrmCostException extends RuntimeException {

    public OrmCostException(String message) {
        super(message);
    }

    public OrmCostException(String message, Throwable cause) {
        super(message, cause);
    }
}
