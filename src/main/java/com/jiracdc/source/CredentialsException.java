package com.jiracdc.source;

/**
 * Thrown when Jira credentials cannot be resolved.
 */
public class CredentialsException extends RuntimeException {
    public CredentialsException(String message) {
        super(message);
    }

    public CredentialsException(String message, Throwable cause) {
        super(message, cause);
    }
}
