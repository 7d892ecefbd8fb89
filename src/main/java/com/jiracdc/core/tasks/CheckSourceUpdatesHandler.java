package com.jiracdc.core.tasks;

import com.jiracdc.core.model.SyncCounters;
import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskKind;
import com.jiracdc.core.model.TaskOutput;
import com.jiracdc.core.model.TaskPayload;
import com.jiracdc.core.sync.SyncEngine;
import org.springframework.stereotype.Component;

@Component
public class CheckSourceUpdatesHandler implements TaskHandler {

    private final SyncEngine syncEngine;

    public CheckSourceUpdatesHandler(SyncEngine syncEngine) {
        this.syncEngine = syncEngine;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.CHECK_SOURCE_UPDATES;
    }

    @Override
    public TaskOutcome execute(SyncTask task, TaskContext context) {
        var payload = (TaskPayload.CheckSourceUpdates) task.payload();
        int changed = syncEngine.countUpdatedIssues(context.config(), payload.since(), context.signal());
        return new TaskOutcome(SyncCounters.ZERO,
                new TaskOutput.UpdateCheck(payload.since(), changed),
                "%d issue(s) updated since %s".formatted(changed, payload.since()));
    }
}
