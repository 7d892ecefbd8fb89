package com.jiracdc.core.tasks;

import com.jiracdc.core.model.SyncCounters;
import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskKind;
import com.jiracdc.core.model.TaskOutput;
import com.jiracdc.core.model.TaskPayload;
import com.jiracdc.source.SourceClient;
import org.springframework.stereotype.Component;

/**
 * Verifies credentials and that the project exists before any issue is written.
 */
@Component
public class FetchProjectInfoHandler implements TaskHandler {

    private final SourceClient sourceClient;

    public FetchProjectInfoHandler(SourceClient sourceClient) {
        this.sourceClient = sourceClient;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.FETCH_PROJECT_INFO;
    }

    @Override
    public TaskOutcome execute(SyncTask task, TaskContext context) {
        var payload = (TaskPayload.FetchProjectInfo) task.payload();
        sourceClient.authenticate(context.signal());
        var project = sourceClient.getProject(payload.projectKey(), context.signal());
        return new TaskOutcome(SyncCounters.ZERO,
                new TaskOutput.ProjectInfo(project.key(), project.name()),
                "Project " + project.key() + ": " + project.name());
    }
}
