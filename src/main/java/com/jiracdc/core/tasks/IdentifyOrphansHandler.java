package com.jiracdc.core.tasks;

import com.jiracdc.core.model.SyncCounters;
import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskKind;
import com.jiracdc.core.model.TaskOutput;
import com.jiracdc.core.sync.SyncEngine;
import org.springframework.stereotype.Component;

@Component
public class IdentifyOrphansHandler implements TaskHandler {

    private final SyncEngine syncEngine;

    public IdentifyOrphansHandler(SyncEngine syncEngine) {
        this.syncEngine = syncEngine;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.IDENTIFY_ORPHANS;
    }

    @Override
    public TaskOutcome execute(SyncTask task, TaskContext context) {
        var orphans = syncEngine.findOrphans(context.config(), context.signal());
        return new TaskOutcome(SyncCounters.ZERO, new TaskOutput.Orphans(orphans),
                orphans.size() + " orphaned file(s)");
    }
}
