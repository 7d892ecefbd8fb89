package com.jiracdc.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Outcome of a single task execution.
 */
public record TaskResult(
    String taskId,
    TaskStatus status,
    SyncCounters counters,
    TaskOutput output,
    String message,
    Duration elapsed
) implements Serializable {

    public static TaskResult completed(String taskId, SyncCounters counters, TaskOutput output,
                                       String message, Duration elapsed) {
        return new TaskResult(taskId, TaskStatus.COMPLETED, counters, output, message, elapsed);
    }

    public static TaskResult failed(String taskId, String message, Duration elapsed) {
        return new TaskResult(taskId, TaskStatus.FAILED, SyncCounters.ZERO, TaskOutput.NONE, message, elapsed);
    }

    public static TaskResult failed(String taskId, SyncCounters partial, String message, Duration elapsed) {
        return new TaskResult(taskId, TaskStatus.FAILED, partial, TaskOutput.NONE, message, elapsed);
    }

    public static TaskResult cancelled(String taskId, Duration elapsed) {
        return new TaskResult(taskId, TaskStatus.CANCELLED, SyncCounters.ZERO, TaskOutput.NONE,
                "cancelled", elapsed);
    }
}
