package com.jiracdc.core.model;

import java.io.Serializable;

/**
 * Parameters of one operation.
 *
 * @param projectKey       Jira project to synchronize
 * @param activeIssuesOnly skip issues in Done, Closed or Resolved
 * @param issueFilter      optional extra JQL clause, ANDed onto the project query
 * @param pageSize         bootstrap page size
 * @param branch           git branch to push to
 */
public record OperationConfig(
    String projectKey,
    boolean activeIssuesOnly,
    String issueFilter,
    int pageSize,
    String branch
) implements Serializable {

    public static final int DEFAULT_PAGE_SIZE = 50;

    public static OperationConfig forProject(String projectKey) {
        return new OperationConfig(projectKey, false, null, DEFAULT_PAGE_SIZE, "main");
    }

    public OperationConfig {
        if (pageSize <= 0) {
            pageSize = DEFAULT_PAGE_SIZE;
        }
        if (branch == null || branch.isBlank()) {
            branch = "main";
        }
    }
}
