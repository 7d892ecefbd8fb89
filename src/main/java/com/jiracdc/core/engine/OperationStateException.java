package com.jiracdc.core.engine;

/**
 * Thrown when an operation is not in a status that permits the requested transition.
 */
public class OperationStateException extends RuntimeException {
    public OperationStateException(String message) {
        super(message);
    }

    public OperationStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
