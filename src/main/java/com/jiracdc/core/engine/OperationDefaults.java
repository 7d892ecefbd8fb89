package com.jiracdc.core.engine;

import com.jiracdc.core.model.OperationConfig;
import com.jiracdc.git.GitProperties;
import org.springframework.stereotype.Component;

/**
 * Fills the parts of an {@link OperationConfig} a caller left out from {@code jiracdc.sync.*}
 * and {@code jiracdc.git.*}.
 */
@Component
public class OperationDefaults {

    private final SyncProperties syncProperties;
    private final GitProperties gitProperties;

    public OperationDefaults(SyncProperties syncProperties, GitProperties gitProperties) {
        this.syncProperties = syncProperties;
        this.gitProperties = gitProperties;
    }

    /**
     * @param projectKey       falls back to the configured project when null or blank
     * @param activeIssuesOnly null for the configured default
     * @param issueFilter      null for the configured default
     * @param pageSize         null or non-positive for the configured default
     * @param branch           null or blank for the configured git branch
     */
    public OperationConfig resolve(String projectKey, Boolean activeIssuesOnly, String issueFilter,
                                   Integer pageSize, String branch) {
        String key = projectKey != null && !projectKey.isBlank() ? projectKey : syncProperties.getProjectKey();
        return new OperationConfig(
                key,
                activeIssuesOnly != null ? activeIssuesOnly : syncProperties.isActiveIssuesOnly(),
                issueFilter != null ? issueFilter : syncProperties.getIssueFilter(),
                pageSize != null && pageSize > 0 ? pageSize : syncProperties.getPageSize(),
                branch != null && !branch.isBlank() ? branch : gitProperties.getBranch());
    }

    /** Config for the configured project with every default applied. */
    public OperationConfig configured() {
        return resolve(null, null, null, null, null);
    }
}
