package com.jiracdc.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of a synchronization operation. The processor replaces the
 * snapshot atomically on every state change, so readers always see a consistent view.
 *
 * @param id            globally unique id (UUID)
 * @param kind          operation kind, selects the task graph template
 * @param status        current lifecycle status
 * @param tasks         tasks of the graph with their current status
 * @param config        operation parameters
 * @param progress      step progress, one step per task
 * @param startTime     when the operation was created
 * @param endTime       when it reached a terminal status (null while pending or running)
 * @param errorMessage  first fatal error (nullable)
 * @param resultSummary aggregated counters (null until the operation ends)
 * @param taskResults   results of tasks that have finished
 */
public record Operation(
    String id,
    OperationKind kind,
    OperationStatus status,
    List<SyncTask> tasks,
    OperationConfig config,
    ProgressSnapshot progress,
    Instant startTime,
    Instant endTime,
    String errorMessage,
    OperationResultSummary resultSummary,
    List<TaskResult> taskResults
) implements Serializable {

    public Operation {
        tasks = List.copyOf(tasks);
        taskResults = List.copyOf(taskResults);
    }

    public static Operation pending(String id, OperationKind kind, List<SyncTask> tasks,
                                    OperationConfig config, Instant startTime) {
        return new Operation(id, kind, OperationStatus.PENDING, tasks, config,
                ProgressSnapshot.start(tasks.size()), startTime, null, null, null, List.of());
    }

    public Operation withStatus(OperationStatus newStatus) {
        return new Operation(id, kind, newStatus, tasks, config, progress, startTime, endTime,
                errorMessage, resultSummary, taskResults);
    }

    public Operation withProgress(ProgressSnapshot newProgress) {
        return new Operation(id, kind, status, tasks, config, newProgress, startTime, endTime,
                errorMessage, resultSummary, taskResults);
    }

    public Operation withError(String message) {
        // keep the first fatal error
        String first = errorMessage != null ? errorMessage : message;
        return new Operation(id, kind, status, tasks, config, progress, startTime, endTime,
                first, resultSummary, taskResults);
    }

    public Operation withTaskStatus(String taskId, TaskStatus taskStatus) {
        var updated = new ArrayList<SyncTask>(tasks.size());
        for (SyncTask t : tasks) {
            updated.add(t.id().equals(taskId) ? t.withStatus(taskStatus) : t);
        }
        return new Operation(id, kind, status, updated, config, progress, startTime, endTime,
                errorMessage, resultSummary, taskResults);
    }

    public Operation withTaskResult(TaskResult result) {
        var results = new ArrayList<>(taskResults);
        results.add(result);
        return new Operation(id, kind, status, tasks, config, progress, startTime, endTime,
                errorMessage, resultSummary, results).withTaskStatus(result.taskId(), result.status());
    }

    /**
     * Moves the operation to a terminal status, stamping the end time and computing the summary.
     */
    public Operation finish(OperationStatus terminal, Instant now) {
        var elapsed = java.time.Duration.between(startTime, now);
        return new Operation(id, kind, terminal, tasks, config, progress, startTime, now,
                errorMessage, OperationResultSummary.of(taskResults, elapsed), taskResults);
    }

    public SyncTask task(String taskId) {
        return tasks.stream().filter(t -> t.id().equals(taskId)).findFirst().orElse(null);
    }
}
