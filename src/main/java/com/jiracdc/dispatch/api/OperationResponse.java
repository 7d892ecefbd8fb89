package com.jiracdc.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jiracdc.core.model.Operation;
import com.jiracdc.core.model.SyncCounters;
import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * JSON response for operation endpoints.
 */
public record OperationResponse(
    @JsonProperty("operation_id") String operationId,
    String kind,
    String status,
    @JsonProperty("project_key") String projectKey,
    @JsonProperty("active_issues_only") boolean activeIssuesOnly,
    @JsonProperty("issue_filter") String issueFilter,
    String branch,
    Progress progress,
    @JsonProperty("start_time") String startTime,
    @JsonProperty("end_time") String endTime,
    @JsonProperty("error_message") String errorMessage,
    Summary summary,
    List<Task> tasks
) {

    public record Progress(
        @JsonProperty("total_steps") int totalSteps,
        @JsonProperty("completed_steps") int completedSteps,
        int percent,
        @JsonProperty("last_message") String lastMessage
    ) {}

    public record Summary(
        @JsonProperty("processed_issues") int processedIssues,
        @JsonProperty("created_files") int createdFiles,
        @JsonProperty("updated_files") int updatedFiles,
        @JsonProperty("deleted_files") int deletedFiles,
        @JsonProperty("unchanged_files") int unchangedFiles,
        int commits,
        @JsonProperty("failed_issues") int failedIssues,
        @JsonProperty("elapsed_ms") long elapsedMs
    ) {}

    public record Task(
        String id,
        String name,
        String kind,
        String status,
        int priority,
        List<String> dependencies,
        String message,
        @JsonProperty("elapsed_ms") Long elapsedMs
    ) {}

    public static OperationResponse from(Operation op) {
        Map<String, TaskResult> results = op.taskResults().stream()
                .collect(Collectors.toMap(TaskResult::taskId, Function.identity(), (a, b) -> b));
        List<Task> tasks = op.tasks().stream()
                .map(t -> toTask(t, results.get(t.id())))
                .toList();

        Summary summary = null;
        if (op.resultSummary() != null) {
            SyncCounters c = op.resultSummary().counters();
            summary = new Summary(c.processedIssues(), c.createdFiles(), c.updatedFiles(), c.deletedFiles(),
                    c.unchangedFiles(), c.commits(), c.failedIssues(), op.resultSummary().elapsed().toMillis());
        }

        var p = op.progress();
        return new OperationResponse(
                op.id(),
                op.kind().name(),
                op.status().name(),
                op.config().projectKey(),
                op.config().activeIssuesOnly(),
                op.config().issueFilter(),
                op.config().branch(),
                new Progress(p.totalSteps(), p.completedSteps(), p.percent(), p.lastMessage()),
                format(op.startTime()),
                format(op.endTime()),
                op.errorMessage(),
                summary,
                tasks);
    }

    private static Task toTask(SyncTask task, TaskResult result) {
        return new Task(task.id(), task.name(), task.kind().name(), task.status().name(), task.priority(),
                task.dependencies(),
                result != null ? result.message() : null,
                result != null && result.elapsed() != null ? result.elapsed().toMillis() : null);
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
