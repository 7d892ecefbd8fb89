package com.jiracdc.git;

/**
 * Failure writing a single issue file. Recorded against that issue only.
 */
public class IssueFileWriteException extends RuntimeException {
    public IssueFileWriteException(String message) {
        super(message);
    }

    public IssueFileWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
