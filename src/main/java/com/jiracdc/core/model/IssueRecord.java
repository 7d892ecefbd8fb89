package com.jiracdc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Issue as returned by the Jira REST API v2. Only the fields this service reads are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IssueRecord {

    private String id;
    private String key;
    private String self;
    private Fields fields;

    public IssueRecord() {
    }

    public IssueRecord(String key, Fields fields) {
        this.key = key;
        this.fields = fields;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }
    public String getSelf() { return self; }
    public void setSelf(String self) { this.self = self; }
    public Fields getFields() { return fields; }
    public void setFields(Fields fields) { this.fields = fields; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Fields {
        private String summary;
        private String description;
        private Named status;
        @JsonProperty("issuetype")
        private Named issueType;
        private Named priority;
        private User assignee;
        private User reporter;
        private List<String> labels;
        private List<Named> components;
        private List<Named> fixVersions;
        private Parent parent;
        private String created;
        private String updated;

        public String getSummary() { return summary; }
        public void setSummary(String summary) { this.summary = summary; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public Named getStatus() { return status; }
        public void setStatus(Named status) { this.status = status; }
        public Named getIssueType() { return issueType; }
        public void setIssueType(Named issueType) { this.issueType = issueType; }
        public Named getPriority() { return priority; }
        public void setPriority(Named priority) { this.priority = priority; }
        public User getAssignee() { return assignee; }
        public void setAssignee(User assignee) { this.assignee = assignee; }
        public User getReporter() { return reporter; }
        public void setReporter(User reporter) { this.reporter = reporter; }
        public List<String> getLabels() { return labels; }
        public void setLabels(List<String> labels) { this.labels = labels; }
        public List<Named> getComponents() { return components; }
        public void setComponents(List<Named> components) { this.components = components; }
        public List<Named> getFixVersions() { return fixVersions; }
        public void setFixVersions(List<Named> fixVersions) { this.fixVersions = fixVersions; }
        public Parent getParent() { return parent; }
        public void setParent(Parent parent) { this.parent = parent; }
        public String getCreated() { return created; }
        public void setCreated(String created) { this.created = created; }
        public String getUpdated() { return updated; }
        public void setUpdated(String updated) { this.updated = updated; }
    }

    /** Status, issue type, priority, component and version objects all carry a name. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Named {
        private String id;
        private String name;

        public Named() {
        }

        public Named(String name) {
            this.name = name;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class User {
        private String name;
        private String accountId;
        private String displayName;
        private String emailAddress;

        public User() {
        }

        public User(String displayName) {
            this.displayName = displayName;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getAccountId() { return accountId; }
        public void setAccountId(String accountId) { this.accountId = accountId; }
        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }
        public String getEmailAddress() { return emailAddress; }
        public void setEmailAddress(String emailAddress) { this.emailAddress = emailAddress; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Parent {
        private String id;
        private String key;

        public Parent() {
        }

        public Parent(String key) {
            this.key = key;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }
    }
}
