package com.jiracdc.source;

import com.jiracdc.core.engine.CancellationSignal;
import com.jiracdc.core.model.IssueRecord;

import java.util.List;

/**
 * Authenticated, rate-limited access to the issue tracker.
 *
 * <p>Every call acquires a rate-limit token first. If {@code signal} fires while waiting the
 * call throws {@link com.jiracdc.core.engine.OperationCancelledException} without issuing a request.
 */
public interface SourceClient {

    /** Fields requested when the caller does not name any. */
    List<String> DEFAULT_FIELDS = List.of(
            "summary", "description", "status", "issuetype", "assignee", "reporter", "priority",
            "labels", "components", "fixVersions", "parent", "created", "updated");

    /** Verifies the credentials by fetching the current user. */
    void authenticate(CancellationSignal signal);

    JiraUser getCurrentUser(CancellationSignal signal);

    JiraProject getProject(String projectKey, CancellationSignal signal);

    SearchPage searchIssues(String jql, int offset, int pageSize, List<String> fields, CancellationSignal signal);

    IssueRecord getIssue(String issueKey, List<String> fields, CancellationSignal signal);

    /**
     * Searches all issues of a project, optionally excluding Done, Closed and Resolved.
     */
    SearchPage getProjectIssues(String projectKey, int offset, int pageSize, boolean activeOnly,
                                CancellationSignal signal);
}
