package com.jiracdc.core.tasks;

import com.jiracdc.core.engine.CancellationSignal;
import com.jiracdc.core.model.OperationConfig;
import com.jiracdc.core.model.SyncProgress;
import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskOutput;
import com.jiracdc.core.model.TaskResult;

import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Everything a handler may read while executing one task.
 *
 * @param operationId      owning operation
 * @param config           operation parameters
 * @param signal           cancellation signal shared by the operation's tasks
 * @param completedResults results of tasks that already finished, by task id
 * @param progressSink     receives item-level progress
 */
public record TaskContext(
    String operationId,
    OperationConfig config,
    CancellationSignal signal,
    Map<String, TaskResult> completedResults,
    Consumer<SyncProgress> progressSink
) {

    /**
     * Finds the output of type {@code type} produced by one of {@code task}'s dependencies.
     */
    public <T extends TaskOutput> Optional<T> dependencyOutput(SyncTask task, Class<T> type) {
        for (String dep : task.dependencies()) {
            TaskResult result = completedResults.get(dep);
            if (result != null && type.isInstance(result.output())) {
                return Optional.of(type.cast(result.output()));
            }
        }
        return Optional.empty();
    }
}
