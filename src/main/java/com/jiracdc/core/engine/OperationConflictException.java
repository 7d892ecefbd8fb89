package com.jiracdc.core.engine;

/**
 * Thrown when an operation is requested for a project that already has one pending or running.
 */
public class OperationConflictException extends RuntimeException {
    public OperationConflictException(String message) {
        super(message);
    }

    public OperationConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
