package com.jiracdc.source;

/**
 * Supplies Jira credentials from an external secret store.
 */
@FunctionalInterface
public interface CredentialsProvider {

    /**
     * Resolves the current credentials.
     *
     * @throws CredentialsException if no usable credentials are available
     */
    JiraCredentials resolve();
}
