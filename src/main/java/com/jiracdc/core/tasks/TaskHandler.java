package com.jiracdc.core.tasks;

import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskKind;

/**
 * Executes one kind of task. Implementations check the context's cancellation signal at safe points.
 */
public interface TaskHandler {

    TaskKind kind();

    /**
     * @throws com.jiracdc.core.engine.OperationCancelledException if cancelled mid-way
     * @throws RuntimeException on failure; the processor records it against the task
     */
    TaskOutcome execute(SyncTask task, TaskContext context);
}
