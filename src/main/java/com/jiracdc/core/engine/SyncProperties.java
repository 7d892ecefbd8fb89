package com.jiracdc.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Synchronization defaults and scheduling bound from {@code jiracdc.sync.*}.
 */
@Component
@ConfigurationProperties(prefix = "jiracdc.sync")
public class SyncProperties {

    /** Project mirrored by the poll scheduler. */
    private String projectKey;
    private boolean activeIssuesOnly = false;
    private String issueFilter;
    private int pageSize = 50;
    private boolean pollingEnabled = false;
    private Duration pollInterval = Duration.ofMinutes(5);
    private int retentionDays = 7;
    private int maxParallelTasks = 4;
    private int operationThreads = 4;

    public String getProjectKey() { return projectKey; }
    public void setProjectKey(String projectKey) { this.projectKey = projectKey; }
    public boolean isActiveIssuesOnly() { return activeIssuesOnly; }
    public void setActiveIssuesOnly(boolean activeIssuesOnly) { this.activeIssuesOnly = activeIssuesOnly; }
    public String getIssueFilter() { return issueFilter; }
    public void setIssueFilter(String issueFilter) { this.issueFilter = issueFilter; }
    public int getPageSize() { return pageSize; }
    public void setPageSize(int pageSize) { this.pageSize = pageSize; }
    public boolean isPollingEnabled() { return pollingEnabled; }
    public void setPollingEnabled(boolean pollingEnabled) { this.pollingEnabled = pollingEnabled; }
    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public int getRetentionDays() { return retentionDays; }
    public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }
    public int getMaxParallelTasks() { return maxParallelTasks; }
    public void setMaxParallelTasks(int maxParallelTasks) { this.maxParallelTasks = maxParallelTasks; }
    public int getOperationThreads() { return operationThreads; }
    public void setOperationThreads(int operationThreads) { this.operationThreads = operationThreads; }
}
