package com.jiracdc.core.engine;

/**
 * Thrown when work stops because its operation was cancelled.
 */
public class OperationCancelledException extends RuntimeException {
    public OperationCancelledException(String message) {
        super(message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
