package com.jiracdc.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jiracdc.core.engine.CancellationSignal;
import com.jiracdc.core.engine.OperationCancelledException;
import com.jiracdc.core.metrics.SyncMetrics;
import com.jiracdc.core.model.IssueRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

/**
 * HTTP client for the Jira REST API v2.
 *
 * <p>Credentials are resolved once, when the client is built, and kept in memory. A missing base URL
 * or unresolvable credentials fail construction with {@link CredentialsException}.
 * When Jira answers 401 the client re-resolves credentials from the {@link CredentialsProvider}
 * and repeats the request once, which picks up a rotated secret. A second 401 surfaces as
 * {@link AuthenticationException}.
 *
 * <p>Each request takes a token from the shared {@link TokenBucketRateLimiter} before it is sent,
 * and transient failures (5xx, 429, timeouts) go through the {@link RetryPolicy}.
 */
public class JiraClient implements SourceClient {

    private static final Logger log = LoggerFactory.getLogger(JiraClient.class);

    private static final String API_PATH = "/rest/api/2";

    private final String baseUrl;
    private final CredentialsProvider credentialsProvider;
    private final TokenBucketRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;
    private final SyncMetrics metrics;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    private volatile JiraCredentials credentials;

    public JiraClient(JiraProperties properties,
                      CredentialsProvider credentialsProvider,
                      TokenBucketRateLimiter rateLimiter,
                      RetryPolicy retryPolicy,
                      ObjectMapper objectMapper,
                      SyncMetrics metrics) {
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new CredentialsException("jiracdc.jira.base-url is required");
        }
        this.baseUrl = stripTrailingSlash(properties.getBaseUrl());
        this.credentialsProvider = credentialsProvider;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .build();
        this.credentials = credentialsProvider.resolve();
        log.info("Jira client configured for {} as {}", baseUrl, credentials.username());
    }

    @Override
    public void authenticate(CancellationSignal signal) {
        var user = getCurrentUser(signal);
        log.info("Authenticated to Jira as {}", user.displayName() != null ? user.displayName() : user.name());
    }

    @Override
    public JiraUser getCurrentUser(CancellationSignal signal) {
        return objectMapper.convertValue(get("/myself", signal), JiraUser.class);
    }

    @Override
    public JiraProject getProject(String projectKey, CancellationSignal signal) {
        return objectMapper.convertValue(get("/project/" + encode(projectKey), signal), JiraProject.class);
    }

    @Override
    public SearchPage searchIssues(String jql, int offset, int pageSize, List<String> fields,
                                   CancellationSignal signal) {
        var effectiveFields = fields == null || fields.isEmpty() ? DEFAULT_FIELDS : fields;
        var path = "/search?jql=" + encode(jql)
                + "&startAt=" + offset
                + "&maxResults=" + pageSize
                + "&fields=" + encode(String.join(",", effectiveFields));

        JsonNode response = get(path, signal);
        List<IssueRecord> issues = response.has("issues")
                ? objectMapper.convertValue(response.get("issues"), new TypeReference<List<IssueRecord>>() {})
                : List.of();
        int total = response.path("total").asInt(issues.size());
        int startAt = response.path("startAt").asInt(offset);
        log.debug("Search '{}' returned {} issue(s) at offset {} of {}", jql, issues.size(), startAt, total);
        return new SearchPage(issues, total, startAt, pageSize);
    }

    @Override
    public IssueRecord getIssue(String issueKey, List<String> fields, CancellationSignal signal) {
        var effectiveFields = fields == null || fields.isEmpty() ? DEFAULT_FIELDS : fields;
        var path = "/issue/" + encode(issueKey) + "?fields=" + encode(String.join(",", effectiveFields));
        return objectMapper.convertValue(get(path, signal), IssueRecord.class);
    }

    @Override
    public SearchPage getProjectIssues(String projectKey, int offset, int pageSize, boolean activeOnly,
                                       CancellationSignal signal) {
        var jql = JqlBuilder.project(projectKey).activeOnly(activeOnly).orderByKey();
        return searchIssues(jql, offset, pageSize, DEFAULT_FIELDS, signal);
    }

    JsonNode get(String path, CancellationSignal signal) {
        return retryPolicy.execute("GET " + path, signal, () -> send(path, signal, true));
    }

    private JsonNode send(String path, CancellationSignal signal, boolean reloadOnUnauthorized) {
        var auth = basicAuth(credentials);
        var waited = rateLimiter.acquire(signal);
        metrics.recordRateLimitWait(waited);

        var request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + API_PATH + path))
                .timeout(requestTimeout)
                .header("Authorization", auth)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            metrics.recordSourceError("timeout");
            throw new TransientApiException("Jira request timed out: GET " + path, e);
        } catch (IOException e) {
            metrics.recordSourceError("network");
            throw new TransientApiException("Jira request failed: GET " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted during Jira request: GET " + path, e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            try {
                return objectMapper.readTree(response.body());
            } catch (IOException e) {
                throw new SourceApiException("Malformed JSON from Jira: GET " + path, e);
            }
        }

        if (status == 401 && reloadOnUnauthorized) {
            log.warn("Jira returned 401 for GET {}, reloading credentials", path);
            reloadCredentials();
            return send(path, signal, false);
        }
        throw toException(status, response);
    }

    private SourceApiException toException(int status, HttpResponse<String> response) {
        var body = response.body();
        if (status == 401 || status == 403) {
            metrics.recordSourceError("auth");
            return new AuthenticationException(status, body);
        }
        if (status == 404) {
            metrics.recordSourceError("not_found");
            return new NotFoundException(status, body);
        }
        if (status == 429 || status >= 500) {
            metrics.recordSourceError(status == 429 ? "rate_limit" : "server");
            return new TransientApiException(status, body, retryAfter(response));
        }
        metrics.recordSourceError("client");
        return new SourceApiException(status, body);
    }

    private synchronized void reloadCredentials() {
        credentials = credentialsProvider.resolve();
    }

    static Duration retryAfter(HttpResponse<?> response) {
        return response.headers().firstValue("Retry-After")
                .map(value -> {
                    try {
                        return Duration.ofSeconds(Long.parseLong(value.trim()));
                    } catch (NumberFormatException e) {
                        // HTTP-date form is not used by Jira
                        return null;
                    }
                })
                .orElse(null);
    }

    private static String basicAuth(JiraCredentials credentials) {
        var raw = credentials.username() + ":" + credentials.token();
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
