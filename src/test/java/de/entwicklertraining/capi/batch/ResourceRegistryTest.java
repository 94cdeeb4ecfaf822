package de.entwicklertraining.capi.batch;

import de.entwicklertraining.capi.ApiClient;
import de.entwicklertraining.capi.ApiPipelineBuilder;
import de.entwicklertraining.capi.MockHttpServer;
import de.entwicklertraining.capi.MockHttpServer.Reply;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResourceRegistryTest {

    private MockHttpServer server;
    private ApiClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockHttpServer();
        client = ApiPipelineBuilder.forEndpoint(server.baseUrl()).build();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void testStandardRegistryCoversCoreResources() {
        ResourceRegistry registry = ResourceRegistry.standard(client);

        assertEquals(Set.of("app", "space", "organization", "route", "service_instance"), registry.resources());
        BatchOperationException e = assertThrows(BatchOperationException.class, () -> registry.require("buildpack"));
        assertEquals("unsupported resource type: buildpack", e.getMessage());
    }

    @Test
    void testBatchAgainstHttpEndpoints() {
        server.enqueue("/v3/apps", Reply.json(201, "{\"guid\":\"app-1\",\"name\":\"web\"}"));
        server.enqueue("/v3/spaces/space-1", Reply.json(200, "{\"guid\":\"space-1\",\"name\":\"renamed\"}"));
        server.enqueue("/v3/routes/route-1",
                new Reply(202, Map.of("Location", server.baseUrl() + "/v3/jobs/job-1"), null));
        BatchExecutor executor = new BatchExecutor(ResourceRegistry.standard(client));

        List<BatchResult> results = executor.execute(new BatchBuilder()
                .addCreateApp("c", new JSONObject().put("name", "web"))
                .addUpdateSpace("u", "space-1", new JSONObject().put("name", "renamed"))
                .addDelete("d", ResourceRegistry.ROUTE, "route-1")
                .build(), CancellationToken.none());

        assertTrue(results.stream().allMatch(BatchResult::success), () -> results.toString());
        assertEquals("app-1", results.get(0).dataAs(JSONObject.class).orElseThrow().getString("guid"));
        assertEquals("renamed", results.get(1).dataAs(JSONObject.class).orElseThrow().getString("name"));
        assertEquals(server.baseUrl() + "/v3/jobs/job-1", results.get(2).data());

        MockHttpServer.Recorded patch = server.requests().stream()
                .filter(r -> r.method().equals("PATCH")).findFirst().orElseThrow();
        assertEquals("/v3/spaces/space-1", patch.path());
        assertEquals("renamed", new JSONObject(patch.body()).getString("name"));
    }

    @Test
    void testApiErrorBecomesFailedResult() {
        ResourceRegistry registry = ResourceRegistry.standard(client);

        List<BatchResult> results = new BatchExecutor(registry).execute(
                List.of(BatchOperation.get("g", ResourceRegistry.APP, "missing")), CancellationToken.none());

        assertFalse(results.get(0).success());
        assertNotNull(results.get(0).error());
    }
}
