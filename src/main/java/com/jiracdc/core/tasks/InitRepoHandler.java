package com.jiracdc.core.tasks;

import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskKind;
import com.jiracdc.git.GitWriter;
import org.springframework.stereotype.Component;

/**
 * Clones the mirror repository, or pulls it when a working copy already exists.
 */
@Component
public class InitRepoHandler implements TaskHandler {

    private final GitWriter gitWriter;

    public InitRepoHandler(GitWriter gitWriter) {
        this.gitWriter = gitWriter;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.INIT_REPO;
    }

    @Override
    public TaskOutcome execute(SyncTask task, TaskContext context) {
        context.signal().throwIfCancelled();
        gitWriter.initialize();
        return TaskOutcome.of("Repository ready");
    }
}
