package com.jiracdc.core.tasks;

import com.jiracdc.core.model.TaskKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the handler for a task kind. Fails fast at startup when a kind has no handler.
 */
@Component
public class TaskHandlerRegistry {

    private final Map<TaskKind, TaskHandler> handlers = new EnumMap<>(TaskKind.class);

    public TaskHandlerRegistry(List<TaskHandler> handlers) {
        for (TaskHandler handler : handlers) {
            if (this.handlers.put(handler.kind(), handler) != null) {
                throw new IllegalStateException("Duplicate handler for task kind " + handler.kind());
            }
        }
        for (TaskKind kind : TaskKind.values()) {
            if (!this.handlers.containsKey(kind)) {
                throw new IllegalStateException("No handler registered for task kind " + kind);
            }
        }
    }

    public TaskHandler get(TaskKind kind) {
        return handlers.get(kind);
    }
}
