package com.jiracdc.source;

/**
 * Username/API-token pair used for Basic authentication against Jira.
 */
public record JiraCredentials(String username, String token) {

    @Override
    public String toString() {
        return "JiraCredentials[username=" + username + ", token=***]";
    }
}
