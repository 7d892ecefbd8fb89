package com.jiracdc.core.tasks;

import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskKind;
import com.jiracdc.git.GitWriter;
import org.springframework.stereotype.Component;

@Component
public class UpdateRepoHandler implements TaskHandler {

    private final GitWriter gitWriter;

    public UpdateRepoHandler(GitWriter gitWriter) {
        this.gitWriter = gitWriter;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.UPDATE_REPO;
    }

    @Override
    public TaskOutcome execute(SyncTask task, TaskContext context) {
        context.signal().throwIfCancelled();
        // initialize() pulls when the working copy exists and clones otherwise
        gitWriter.initialize();
        return TaskOutcome.of("Repository up to date");
    }
}
