package com.jiracdc.git;

/**
 * Commit or push failure. Aborts the current batch.
 */
public class GitWriteException extends RuntimeException {
    public GitWriteException(String message) {
        super(message);
    }

    public GitWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
