package com.jiracdc.dispatch.api;

/**
 * The mirror repository has no file for the requested issue.
 */
public class IssueNotFoundException extends RuntimeException {
    public IssueNotFoundException(String message) {
        super(message);
    }
}
