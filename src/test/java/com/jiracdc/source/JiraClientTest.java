package com.jiracdc.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jiracdc.core.engine.CancellationSignal;
import com.jiracdc.core.metrics.SyncMetrics;
import com.jiracdc.core.model.IssueRecord;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises {@link JiraClient} against an in-process HTTP stub.
 */
class JiraClientTest {

    private HttpServer server;
    private final List<URI> requests = new CopyOnWriteArrayList<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private volatile Function<HttpExchange, StubResponse> handler;

    private SimpleMeterRegistry registry;
    private JiraProperties properties;

    record StubResponse(int status, String body, Map<String, String> headers) {
        static StubResponse ok(String body) {
            return new StubResponse(200, body, Map.of());
        }

        static StubResponse status(int status, String body) {
            return new StubResponse(status, body, Map.of());
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            requests.add(exchange.getRequestURI());
            authHeaders.add(exchange.getRequestHeaders().getFirst("Authorization"));
            StubResponse response = handler.apply(exchange);
            response.headers().forEach((k, v) -> exchange.getResponseHeaders().add(k, v));
            byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(response.status(), bytes.length == 0 ? -1 : bytes.length);
            if (bytes.length > 0) {
                exchange.getResponseBody().write(bytes);
            }
            exchange.close();
        });
        server.start();

        registry = new SimpleMeterRegistry();
        properties = new JiraProperties();
        properties.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/");
        properties.setUsername("sync-bot");
        properties.setToken("secret");
        properties.setRequestTimeoutSeconds(5);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private JiraClient client(CredentialsProvider credentials, RetryPolicy retryPolicy) {
        return new JiraClient(properties, credentials, new TokenBucketRateLimiter(1000, 1000),
                retryPolicy, new ObjectMapper(), new SyncMetrics(registry));
    }

    private JiraClient client() {
        return client(new SecretDirectoryCredentialsProvider(properties), RetryPolicy.noRetry());
    }

    private static String query(URI uri, String name) {
        for (String pair : uri.getRawQuery().split("&")) {
            int eq = pair.indexOf('=');
            if (pair.substring(0, eq).equals(name)) {
                return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static String searchBody(int startAt, int total, String... keys) {
        var issues = new ArrayList<String>();
        for (String key : keys) {
            issues.add("""
                    {"id":"1","key":"%s","fields":{"summary":"Summary of %s","status":{"name":"Open"},
                     "issuetype":{"name":"Task"},"labels":["backend"],"unknownField":42}}
                    """.formatted(key, key));
        }
        return """
                {"startAt":%d,"maxResults":50,"total":%d,"issues":[%s]}
                """.formatted(startAt, total, String.join(",", issues));
    }

    @Nested
    @DisplayName("requests")
    class Requests {

        @Test
        @DisplayName("sends Basic auth built from the configured credentials")
        void basicAuth() {
            handler = ex -> StubResponse.ok("{\"name\":\"sync-bot\",\"displayName\":\"Sync Bot\",\"active\":true}");

            JiraUser user = client().getCurrentUser(CancellationSignal.none());

            assertEquals("Sync Bot", user.displayName());
            assertEquals("/rest/api/2/myself", requests.get(0).getPath());
            String expected = "Basic " + Base64.getEncoder()
                    .encodeToString("sync-bot:secret".getBytes(StandardCharsets.UTF_8));
            assertEquals(expected, authHeaders.get(0));
        }

        @Test
        @DisplayName("project issues with activeOnly excludes finished statuses in the JQL")
        void projectIssuesActiveOnly() {
            handler = ex -> StubResponse.ok(searchBody(0, 2, "PROJ-1", "PROJ-2"));

            SearchPage page = client().getProjectIssues("PROJ", 0, 50, true, CancellationSignal.none());

            assertEquals(2, page.items().size());
            assertEquals(2, page.totalCount());
            assertEquals("PROJ-1", page.items().get(0).getKey());
            assertEquals("Task", page.items().get(0).getFields().getIssueType().getName());

            URI uri = requests.get(0);
            assertEquals("/rest/api/2/search", uri.getPath());
            assertEquals("project = PROJ AND status != Done AND status != Closed AND status != Resolved ORDER BY key ASC",
                    query(uri, "jql"));
            assertEquals("0", query(uri, "startAt"));
            assertEquals("50", query(uri, "maxResults"));
            assertTrue(query(uri, "fields").contains("issuetype"));
        }

        @Test
        @DisplayName("getIssue maps the response into an IssueRecord")
        void getIssue() {
            handler = ex -> StubResponse.ok("""
                    {"key":"PROJ-7","fields":{"summary":"Fix login","description":"Steps",
                     "status":{"name":"In Progress"},"assignee":{"displayName":"Ada"},
                     "parent":{"key":"PROJ-1"},"created":"2024-01-15T10:30:00.000+0000"}}
                    """);

            IssueRecord record = client().getIssue("PROJ-7", List.of(), CancellationSignal.none());

            assertEquals("PROJ-7", record.getKey());
            assertEquals("Fix login", record.getFields().getSummary());
            assertEquals("Ada", record.getFields().getAssignee().getDisplayName());
            assertEquals("PROJ-1", record.getFields().getParent().getKey());
            assertEquals("/rest/api/2/issue/PROJ-7", requests.get(0).getPath());
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("404 maps to NotFoundException")
        void notFound() {
            handler = ex -> StubResponse.status(404, "{\"errorMessages\":[\"Issue does not exist\"]}");

            var e = assertThrows(NotFoundException.class,
                    () -> client().getIssue("PROJ-404", List.of(), CancellationSignal.none()));
            assertEquals(404, e.getStatusCode());
            assertTrue(e.getResponseBody().contains("Issue does not exist"));
        }

        @Test
        @DisplayName("other non-2xx carries status and body")
        void clientError() {
            handler = ex -> StubResponse.status(400, "{\"errorMessages\":[\"bad jql\"]}");

            var e = assertThrows(SourceApiException.class,
                    () -> client().searchIssues("nonsense", 0, 10, List.of(), CancellationSignal.none()));
            assertEquals(400, e.getStatusCode());
            assertTrue(e.getMessage().contains("status 400"));
            assertTrue(e.getMessage().contains("bad jql"));
            assertEquals(1.0, registry.find("jiracdc.source.errors").tag("type", "client").counter().count());
        }

        @Test
        @DisplayName("503 is retried and then succeeds")
        void transientRetried() {
            var calls = new AtomicInteger();
            handler = ex -> calls.incrementAndGet() == 1
                    ? StubResponse.status(503, "busy")
                    : StubResponse.ok("{\"id\":\"10\",\"key\":\"PROJ\",\"name\":\"Project\"}");
            var retry = new RetryPolicy(3, Duration.ofMillis(5), Duration.ofMillis(10), 2.0, false);

            JiraProject project = client(new SecretDirectoryCredentialsProvider(properties), retry)
                    .getProject("PROJ", CancellationSignal.none());

            assertEquals("Project", project.name());
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("429 exposes Retry-After")
        void rateLimitedRetryAfter() {
            handler = ex -> new StubResponse(429, "slow down", Map.of("Retry-After", "12"));

            var e = assertThrows(TransientApiException.class,
                    () -> client().getProject("PROJ", CancellationSignal.none()));
            assertEquals(Duration.ofSeconds(12), e.getRetryAfter());
        }

        @Test
        @DisplayName("401 reloads credentials once and retries with the new ones")
        void unauthorizedReloadsCredentials() {
            var resolutions = new AtomicInteger();
            CredentialsProvider rotating = () -> resolutions.incrementAndGet() == 1
                    ? new JiraCredentials("sync-bot", "expired")
                    : new JiraCredentials("sync-bot", "rotated");
            String rotatedAuth = "Basic " + Base64.getEncoder()
                    .encodeToString("sync-bot:rotated".getBytes(StandardCharsets.UTF_8));
            handler = ex -> rotatedAuth.equals(ex.getRequestHeaders().getFirst("Authorization"))
                    ? StubResponse.ok("{\"name\":\"sync-bot\"}")
                    : StubResponse.status(401, "");

            JiraUser user = client(rotating, RetryPolicy.noRetry()).getCurrentUser(CancellationSignal.none());

            assertEquals("sync-bot", user.name());
            assertEquals(2, requests.size());
            assertEquals(2, resolutions.get());
        }

        @Test
        @DisplayName("401 after reload raises AuthenticationException")
        void unauthorizedTwice() {
            handler = ex -> StubResponse.status(401, "");

            assertThrows(AuthenticationException.class,
                    () -> client().authenticate(CancellationSignal.none()));
            assertEquals(2, requests.size());
        }

        @Test
        @DisplayName("missing base URL fails construction")
        void missingBaseUrl() {
            properties.setBaseUrl(" ");

            assertThrows(CredentialsException.class, JiraClientTest.this::client);
            assertTrue(requests.isEmpty());
        }

        @Test
        @DisplayName("credentials are resolved once, when the client is built")
        void credentialsResolvedAtConstruction() {
            var resolutions = new AtomicInteger();
            CredentialsProvider counting = () -> {
                resolutions.incrementAndGet();
                return new JiraCredentials("sync-bot", "secret");
            };
            handler = ex -> StubResponse.ok("{\"name\":\"sync-bot\"}");

            JiraClient client = client(counting, RetryPolicy.noRetry());
            assertEquals(1, resolutions.get());

            client.authenticate(CancellationSignal.none());
            client.getCurrentUser(CancellationSignal.none());
            assertEquals(1, resolutions.get());
        }

        @Test
        @DisplayName("unresolvable credentials fail construction")
        void unresolvableCredentials() {
            properties.setUsername(null);
            properties.setToken(null);

            assertThrows(CredentialsException.class, JiraClientTest.this::client);
            assertTrue(requests.isEmpty());
        }
    }
}
