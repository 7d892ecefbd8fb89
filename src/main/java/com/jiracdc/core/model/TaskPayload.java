package com.jiracdc.core.model;

import java.io.Serializable;

/**
 * Kind-specific task parameters. One record per {@link TaskKind}.
 */
public sealed interface TaskPayload extends Serializable
        permits TaskPayload.InitRepo, TaskPayload.FetchProjectInfo, TaskPayload.BootstrapSync,
                TaskPayload.CheckSourceUpdates, TaskPayload.UpdateRepo, TaskPayload.SyncUpdatedIssues,
                TaskPayload.IdentifyOrphans, TaskPayload.RemoveOrphans {

    record InitRepo(String branch) implements TaskPayload {}

    record FetchProjectInfo(String projectKey) implements TaskPayload {}

    /**
     * @param overwrite rewrite every file even when content is unchanged (forced sync)
     * @param pageSize  issues fetched per page
     */
    record BootstrapSync(boolean overwrite, int pageSize) implements TaskPayload {}

    /**
     * @param since JQL date expression for the lower bound of {@code updated}, e.g. "-24h"
     */
    record CheckSourceUpdates(String since) implements TaskPayload {}

    record UpdateRepo(String branch) implements TaskPayload {}

    record SyncUpdatedIssues(String since) implements TaskPayload {}

    record IdentifyOrphans(String projectKey) implements TaskPayload {}

    record RemoveOrphans(String branch) implements TaskPayload {}
}
