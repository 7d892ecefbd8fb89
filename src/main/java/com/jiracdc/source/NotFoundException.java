package com.jiracdc.source;

/**
 * The referenced issue or project does not exist (HTTP 404).
 */
public class NotFoundException extends SourceApiException {
    public NotFoundException(int statusCode, String responseBody) {
        super(statusCode, responseBody);
    }
}
