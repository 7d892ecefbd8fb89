package com.jiracdc.core.graph;

/**
 * Thrown when a task graph has a cycle or references an unknown dependency.
 */
public class TaskGraphValidationException extends RuntimeException {
    public TaskGraphValidationException(String message) {
        super(message);
    }

    public TaskGraphValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
