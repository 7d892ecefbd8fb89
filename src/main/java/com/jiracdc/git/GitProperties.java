package com.jiracdc.git;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Mirror repository settings bound from {@code jiracdc.git.*}.
 */
@Component
@ConfigurationProperties(prefix = "jiracdc.git")
public class GitProperties {

    /** Remote to clone from and push to. Blank keeps the repository local-only. */
    private String remoteUrl;
    private String branch = "main";
    private String workingDirectory = "./data/repository";
    private String authorName = "JIRA CDC Operator";
    private String authorEmail = "jiracdc@example.com";

    public String getRemoteUrl() { return remoteUrl; }
    public void setRemoteUrl(String remoteUrl) { this.remoteUrl = remoteUrl; }
    public String getBranch() { return branch; }
    public void setBranch(String branch) { this.branch = branch; }
    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
    public String getAuthorName() { return authorName; }
    public void setAuthorName(String authorName) { this.authorName = authorName; }
    public String getAuthorEmail() { return authorEmail; }
    public void setAuthorEmail(String authorEmail) { this.authorEmail = authorEmail; }

    public boolean hasRemote() {
        return remoteUrl != null && !remoteUrl.isBlank();
    }
}
