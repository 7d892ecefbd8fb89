package com.jiracdc.core.engine;

/**
 * Thrown when no operation exists with the requested id.
 */
public class OperationNotFoundException extends RuntimeException {
    public OperationNotFoundException(String message) {
        super(message);
    }

    public OperationNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
