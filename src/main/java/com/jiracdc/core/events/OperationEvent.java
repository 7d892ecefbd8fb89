package com.jiracdc.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while an operation executes.
 *
 * @param eventType   e.g. "operation.started", "task.completed", "operation.progress"
 * @param operationId the operation this event belongs to
 * @param taskId      the task this event relates to (nullable for operation-level events)
 * @param payload     event details
 * @param timestamp   when the event occurred
 */
public record OperationEvent(
    String eventType,
    String operationId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public boolean isTerminal() {
        return "operation.completed".equals(eventType)
                || "operation.failed".equals(eventType)
                || "operation.cancelled".equals(eventType);
    }
}
