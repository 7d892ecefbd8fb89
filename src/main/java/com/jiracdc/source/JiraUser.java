package com.jiracdc.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The authenticated user from {@code /rest/api/2/myself}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JiraUser(String accountId, String name, String displayName, String emailAddress, boolean active) {}
