package com.jiracdc.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Project metadata from {@code /rest/api/2/project/{key}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JiraProject(String id, String key, String name, String description) {}
