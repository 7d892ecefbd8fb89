package com.jiracdc.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/operations.
 *
 * @param kind             BOOTSTRAP, RECONCILE, FORCED_SYNC or CLEANUP
 * @param projectKey       nullable, falls back to the configured project
 * @param activeIssuesOnly nullable, falls back to the configured default
 * @param issueFilter      extra JQL clause; nullable
 * @param pageSize         nullable, falls back to the configured page size
 * @param branch           nullable, falls back to the configured git branch
 */
public record OperationRequest(
    String kind,
    @JsonProperty("project_key") String projectKey,
    @JsonProperty("active_issues_only") Boolean activeIssuesOnly,
    @JsonProperty("issue_filter") String issueFilter,
    @JsonProperty("page_size") Integer pageSize,
    String branch
) {}
