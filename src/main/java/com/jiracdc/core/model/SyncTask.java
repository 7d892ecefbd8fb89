package com.jiracdc.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A single unit of work within an operation's task graph.
 *
 * @param id           unique identifier within the operation (e.g. "TASK-1")
 * @param name         display name, usually {@link TaskKind#taskName()}
 * @param description  what this task does
 * @param kind         task type, selects the handler that executes it
 * @param status       current execution status
 * @param priority     higher runs first when several tasks are eligible
 * @param dependencies IDs of tasks that must complete first
 * @param payload      typed, kind-specific parameters
 */
public record SyncTask(
    String id,
    String name,
    String description,
    TaskKind kind,
    TaskStatus status,
    int priority,
    List<String> dependencies,
    TaskPayload payload
) implements Serializable {

    public SyncTask withStatus(TaskStatus newStatus) {
        return new SyncTask(id, name, description, kind, newStatus, priority, dependencies, payload);
    }
}
