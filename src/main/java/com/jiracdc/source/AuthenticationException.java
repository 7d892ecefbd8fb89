package com.jiracdc.source;

/**
 * Invalid or expired credentials (HTTP 401/403). Never retried automatically.
 */
public class AuthenticationException extends SourceApiException {
    public AuthenticationException(int statusCode, String responseBody) {
        super(statusCode, responseBody);
    }
}
