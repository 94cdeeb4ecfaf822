package de.entwicklertraining.capi.pagination;

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

import static org.junit.jupiter.api.Assertions.*;

class JsonPaginationClientTest {

    private MockHttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockHttpServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static String page(String next, String... names) {
        JSONObject pagination = new JSONObject()
                .put("total_results", 3)
                .put("total_pages", 2)
                .put("first", new JSONObject().put("href", "https://api.example.com/v3/apps?page=1"))
                .put("next", next == null ? JSONObject.NULL : new JSONObject().put("href", next));
        JSONObject body = new JSONObject().put("pagination", pagination);
        for (String name : names) {
            body.append("resources", new JSONObject().put("name", name));
        }
        return body.toString();
    }

    @Test
    void testParse() {
        ListResponse<String> response = JsonPaginationClient.parse(
                page("https://api.example.com/v3/apps?page=2&per_page=2", "a", "b"), json -> json.getString("name"));

        assertEquals(List.of("a", "b"), response.resources());
        assertEquals(3, response.pagination().totalResults());
        assertEquals(2, response.pagination().totalPages());
        assertTrue(response.pagination().hasNext());
        assertEquals(2, response.pagination().getNext().orElseThrow().queryInt("page").orElseThrow());
        assertTrue(response.pagination().getPrevious().isEmpty());
    }

    @Test
    void testParseWithoutPagination() {
        ListResponse<JSONObject> response = JsonPaginationClient.parse("{}", json -> json);

        assertTrue(response.resources().isEmpty());
        assertFalse(response.pagination().hasNext());
    }

    @Test
    void testWalksPagesOverHttp() {
        server.handle("/v3/apps", recorded -> recorded.query() != null && List.of(recorded.query().split("&")).contains("page=2")
                ? Reply.json(200, page(null, "c"))
                : Reply.json(200, page(server.baseUrl() + "/v3/apps?page=2&per_page=2", "a", "b")));
        ApiClient client = ApiPipelineBuilder.forEndpoint(server.baseUrl()).build();
        JsonPaginationClient<String> apps = new JsonPaginationClient<>(client, json -> json.getString("name"));

        List<String> names = Paginator.fetchAllPages(apps, "/v3/apps",
                QueryParams.create().withPerPage(2).withOrderBy("name"), null, CancellationToken.none());

        assertEquals(List.of("a", "b", "c"), names);
        assertEquals(2, server.hits());
        String firstQuery = server.requests().get(0).query();
        assertTrue(firstQuery.contains("per_page=2"), firstQuery);
        assertTrue(firstQuery.contains("order_by=name"), firstQuery);
    }
}
