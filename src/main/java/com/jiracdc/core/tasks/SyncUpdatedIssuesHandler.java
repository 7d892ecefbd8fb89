package com.jiracdc.core.tasks;

import com.jiracdc.core.model.SyncCounters;
import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskKind;
import com.jiracdc.core.model.TaskOutput;
import com.jiracdc.core.model.TaskPayload;
import com.jiracdc.core.sync.SyncEngine;
import org.springframework.stereotype.Component;

/**
 * Writes issues changed since the reconcile window. Skips the search entirely when
 * CheckSourceUpdates found nothing.
 */
@Component
public class SyncUpdatedIssuesHandler implements TaskHandler {

    private final SyncEngine syncEngine;

    public SyncUpdatedIssuesHandler(SyncEngine syncEngine) {
        this.syncEngine = syncEngine;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.SYNC_UPDATED_ISSUES;
    }

    @Override
    public TaskOutcome execute(SyncTask task, TaskContext context) {
        var payload = (TaskPayload.SyncUpdatedIssues) task.payload();
        var check = context.dependencyOutput(task, TaskOutput.UpdateCheck.class);
        if (check.isPresent() && check.get().changedCount() == 0) {
            return TaskOutcome.of("No issues updated since " + payload.since());
        }
        var since = check.map(TaskOutput.UpdateCheck::since).orElse(payload.since());
        var results = syncEngine.synchronizeProject(context.config(), false, since,
                context.progressSink(), context.signal());
        var counters = SyncCounters.fromResults(results);
        return new TaskOutcome(counters, TaskOutput.NONE,
                "Reconciled %d issue(s), %d failed".formatted(counters.processedIssues(), counters.failedIssues()));
    }
}
