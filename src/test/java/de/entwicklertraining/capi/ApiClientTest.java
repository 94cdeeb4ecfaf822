package de.entwicklertraining.capi;

import de.entwicklertraining.capi.MockHttpServer.Reply;
import de.entwicklertraining.capi.cancellation.CancellationException;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import de.entwicklertraining.capi.cancellation.CancellationTokenSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the retry loop and error mapping against a local HTTP server.
 */
class ApiClientTest {

    private MockHttpServer server;
    private ApiClientSettings settings;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockHttpServer();
        settings = ApiClientSettings.builder()
                .retryConfig(RetryConfig.builder()
                        .maxRetries(3)
                        .retryDelay(Duration.ofMillis(10))
                        .maxDelay(Duration.ofMillis(50))
                        .build())
                .useJitter(false)
                .requestTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private ApiClient client() {
        return ApiPipelineBuilder.forEndpoint(server.baseUrl()).settings(settings).build();
    }

    @Test
    @DisplayName("Two server errors followed by success take three attempts")
    void testRetriesUntilSuccess() {
        server.enqueue("/v3/apps",
                Reply.json(500, "{}"),
                Reply.json(500, "{}"),
                Reply.json(200, "{\"resources\":[]}"));

        ApiResponse response = client().execute(ApiRequest.get("/v3/apps"), CancellationToken.none());

        assertEquals(200, response.getStatusCode());
        assertEquals(3, server.hits());
    }

    @Test
    void testRateLimitedThenSuccess() {
        server.enqueue("/v3/apps",
                new Reply(429, Map.of("Retry-After", "0"), ""),
                Reply.json(200, "{}"));

        ApiResponse response = client().execute(ApiRequest.get("/v3/apps"), CancellationToken.none());

        assertTrue(response.isSuccess());
        assertEquals(2, server.hits());
    }

    @Test
    void testClientErrorIsNotRetried() {
        server.enqueue("/v3/apps", Reply.json(400,
                "{\"errors\":[{\"code\":1001,\"title\":\"CF-MessageParseError\",\"detail\":\"bad\"}]}"));

        ApiException e = assertThrows(ApiException.class,
                () -> client().execute(ApiRequest.get("/v3/apps"), CancellationToken.none()));

        assertEquals(400, e.getStatusCode());
        assertEquals(1, server.hits());
    }

    @Test
    void testRetriesExhaustedReturnsLastError() {
        server.enqueue("/v3/apps", Reply.json(503, "{}"));

        ApiException e = assertThrows(ApiException.class,
                () -> client().execute(ApiRequest.get("/v3/apps"), CancellationToken.none()));

        assertEquals(503, e.getStatusCode());
        assertEquals(4, server.hits());
    }

    @Test
    void testExecuteWithRetryReturnsErrorStatusWithoutThrowing() {
        server.enqueue("/v3/apps/missing", Reply.json(404, "{}"));

        ApiResponse response = client().executeWithRetry(ApiRequest.get("/v3/apps/missing"), CancellationToken.none());

        assertEquals(404, response.getStatusCode());
        assertFalse(response.isSuccess());
    }

    @Test
    void testHeadersAndBodyAreSent() {
        server.enqueue("/v3/spaces", Reply.json(201, "{\"guid\":\"s1\"}"));
        ApiHttpConfiguration httpConfig = ApiHttpConfiguration.builder()
                .header("X-Global", "g")
                .userAgent("test-agent/1.0")
                .build();
        ApiClient client = ApiPipelineBuilder.forEndpoint(server.baseUrl() + "/")
                .settings(settings)
                .httpConfiguration(httpConfig)
                .header("X-Custom", "c")
                .build();

        client.execute(ApiRequest.post("/v3/spaces", "{\"name\":\"dev\"}"), CancellationToken.none());

        MockHttpServer.Recorded recorded = server.requests().get(0);
        assertEquals("POST", recorded.method());
        assertEquals("{\"name\":\"dev\"}", recorded.body());
        assertEquals("application/json", recorded.header("Content-Type"));
        assertEquals("application/json", recorded.header("Accept"));
        assertEquals("g", recorded.header("X-Global"));
        assertEquals("c", recorded.header("X-Custom"));
        assertEquals("test-agent/1.0", recorded.header("User-Agent"));
    }

    @Test
    void testTransportFailureIsRetriedAndReported() {
        // nothing listens on port 1
        ApiClient client = ApiPipelineBuilder.forEndpoint("http://127.0.0.1:1")
                .settings(settings.toBuilder()
                        .retryConfig(settings.getRetryConfig().toBuilder().maxRetries(1).build())
                        .build())
                .build();

        ApiClientException e = assertThrows(ApiClientException.class,
                () -> client.execute(ApiRequest.get("/v3/info"), CancellationToken.none()));

        assertTrue(e.getKind() == ErrorKind.TRANSPORT || e.getKind() == ErrorKind.TIMEOUT);
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testCancellationDuringBackoffStopsRetries() {
        server.enqueue("/v3/apps", Reply.json(503, "{}"));
        ApiClient client = ApiPipelineBuilder.forEndpoint(server.baseUrl())
                .settings(settings.toBuilder()
                        .retryConfig(RetryConfig.builder()
                                .maxRetries(5)
                                .retryDelay(Duration.ofSeconds(2))
                                .maxDelay(Duration.ofSeconds(2))
                                .build())
                        .build())
                .build();
        CancellationTokenSource source = CancellationTokenSource.create();
        new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
            source.cancel();
        }).start();

        assertThrows(CancellationException.class,
                () -> client.execute(ApiRequest.get("/v3/apps"), source.getToken()));
        assertEquals(1, server.hits());
    }

    @Test
    void testBackoffSkippedWhenDeadlineTooClose() {
        server.enqueue("/v3/apps", Reply.json(503, "{}"));
        ApiClient client = ApiPipelineBuilder.forEndpoint(server.baseUrl())
                .settings(settings.toBuilder()
                        .retryConfig(RetryConfig.builder()
                                .retryDelay(Duration.ofSeconds(10))
                                .maxDelay(Duration.ofSeconds(10))
                                .build())
                        .build())
                .build();

        ApiClient.ApiTimeoutException e = assertThrows(ApiClient.ApiTimeoutException.class,
                () -> client.execute(ApiRequest.get("/v3/apps"), CancellationToken.withTimeout(Duration.ofSeconds(2))));

        assertEquals(ErrorKind.TIMEOUT, e.getKind());
    }

    @Test
    void testExponentialBackoffWithoutJitter() {
        ApiClient client = client();

        assertEquals(200, client.calculateNextSleep(100));
        assertEquals(400, client.calculateNextSleep(200));
    }
}
