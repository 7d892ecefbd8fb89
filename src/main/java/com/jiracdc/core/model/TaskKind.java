package com.jiracdc.core.model;

/**
 * The unit-of-work types that make up operation task graphs.
 */
public enum TaskKind {
    INIT_REPO("InitRepo"),
    FETCH_PROJECT_INFO("FetchProjectInfo"),
    BOOTSTRAP_SYNC("BootstrapSync"),
    CHECK_SOURCE_UPDATES("CheckSourceUpdates"),
    UPDATE_REPO("UpdateRepo"),
    SYNC_UPDATED_ISSUES("SyncUpdatedIssues"),
    IDENTIFY_ORPHANS("IdentifyOrphans"),
    REMOVE_ORPHANS("RemoveOrphans");

    private final String taskName;

    TaskKind(String taskName) {
        this.taskName = taskName;
    }

    /** Display name used for task names and log output, e.g. "BootstrapSync". */
    public String taskName() {
        return taskName;
    }
}
