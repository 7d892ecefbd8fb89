package com.jiracdc.core.engine;

import com.jiracdc.core.model.Operation;

/**
 * Thrown by {@link OperationProcessor#waitForCompletion} when the deadline passes before the
 * operation ends. Carries the last observed snapshot, which may still be running.
 */
public class OperationTimeoutException extends RuntimeException {

    private final transient Operation lastSnapshot;

    public OperationTimeoutException(String message, Operation lastSnapshot) {
        super(message);
        this.lastSnapshot = lastSnapshot;
    }

    public Operation getLastSnapshot() {
        return lastSnapshot;
    }
}
