package com.jiracdc.core.tasks;

import com.jiracdc.core.model.SyncCounters;
import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskKind;
import com.jiracdc.core.model.TaskOutput;
import com.jiracdc.core.model.TaskPayload;
import com.jiracdc.core.sync.SyncEngine;
import org.springframework.stereotype.Component;

/**
 * Full paginated sync. Used by both bootstrap and forced sync; the payload's overwrite flag differs.
 */
@Component
public class BootstrapSyncHandler implements TaskHandler {

    private final SyncEngine syncEngine;

    public BootstrapSyncHandler(SyncEngine syncEngine) {
        this.syncEngine = syncEngine;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.BOOTSTRAP_SYNC;
    }

    @Override
    public TaskOutcome execute(SyncTask task, TaskContext context) {
        var payload = (TaskPayload.BootstrapSync) task.payload();
        var results = syncEngine.bootstrap(context.config(), payload.overwrite(),
                context.progressSink(), context.signal());
        var counters = SyncCounters.fromResults(results);
        return new TaskOutcome(counters, TaskOutput.NONE,
                "Synchronized %d issue(s), %d failed".formatted(counters.processedIssues(), counters.failedIssues()));
    }
}
