package com.jiracdc.source;

/**
 * Non-success response from the Jira REST API. Carries the HTTP status and response body.
 * A status of 0 means the request never produced a response (I/O failure).
 */
public class SourceApiException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public SourceApiException(int statusCode, String responseBody) {
        this("JIRA API error: status %d, body: %s".formatted(statusCode, responseBody), statusCode, responseBody);
    }

    public SourceApiException(String message, int statusCode, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public SourceApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.responseBody = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
