package com.jiracdc.source;

import java.time.Duration;

/**
 * 5xx, 429 or an I/O timeout. Eligible for bounded retry.
 */
public class TransientApiException extends SourceApiException {

    private final Duration retryAfter;

    public TransientApiException(int statusCode, String responseBody, Duration retryAfter) {
        super(statusCode, responseBody);
        this.retryAfter = retryAfter;
    }

    public TransientApiException(String message, Throwable cause) {
        super(message, cause);
        this.retryAfter = null;
    }

    /** Server-requested delay from a Retry-After header, or null. */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
