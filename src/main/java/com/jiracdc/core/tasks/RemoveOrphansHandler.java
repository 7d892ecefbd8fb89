package com.jiracdc.core.tasks;

import com.jiracdc.core.model.SyncCounters;
import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskKind;
import com.jiracdc.core.model.TaskOutput;
import com.jiracdc.core.model.TaskPayload;
import com.jiracdc.core.sync.SyncEngine;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class RemoveOrphansHandler implements TaskHandler {

    private final SyncEngine syncEngine;

    public RemoveOrphansHandler(SyncEngine syncEngine) {
        this.syncEngine = syncEngine;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.REMOVE_ORPHANS;
    }

    @Override
    public TaskOutcome execute(SyncTask task, TaskContext context) {
        var payload = (TaskPayload.RemoveOrphans) task.payload();
        List<String> orphans = context.dependencyOutput(task, TaskOutput.Orphans.class)
                .map(TaskOutput.Orphans::issueKeys)
                .orElse(List.of());
        if (orphans.isEmpty()) {
            return TaskOutcome.of("Nothing to remove");
        }
        var results = syncEngine.removeIssues(orphans, payload.branch(), context.progressSink(), context.signal());
        var counters = SyncCounters.fromResults(results);
        return new TaskOutcome(counters, TaskOutput.NONE,
                "Removed %d file(s)".formatted(counters.deletedFiles()));
    }
}
