package de.entwicklertraining.capi;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApiRequestTest {

    @Test
    void testRelativeUrlSortsAndEncodesQuery() {
        ApiRequest request = ApiRequest.builder("get", "/v3/apps")
                .queryParam("names", "a b,c")
                .queryParam("fields[space]", "name")
                .queryParam("page", "2")
                .build();

        assertEquals("GET", request.getMethod());
        assertEquals("/v3/apps?fields[space]=name&names=a+b,c&page=2", request.getRelativeUrl());
    }

    @Test
    void testHeadersAreCaseInsensitive() {
        ApiRequest request = ApiRequest.get("/v3/info");
        request.setHeader("Authorization", "Bearer x");

        assertEquals("Bearer x", request.getHeader("authorization").orElseThrow());
        request.removeHeader("AUTHORIZATION");
        assertTrue(request.getHeader("Authorization").isEmpty());
    }

    @Test
    void testJsonBodySetsContentType() {
        ApiRequest request = ApiRequest.post("/v3/apps", "{\"name\":\"x\"}");

        assertTrue(request.hasBody());
        assertTrue(request.isMutating());
        assertEquals("application/json", request.getHeader("Content-Type").orElseThrow());
        assertEquals("{\"name\":\"x\"}", request.getBodyAsString());
    }

    @Test
    void testGetIsNotMutating() {
        ApiRequest request = ApiRequest.builder("GET", "/v3/spaces").queryParams(Map.of("a", "1")).build();

        assertFalse(request.isMutating());
        assertFalse(request.hasBody());
        assertEquals(Map.of("a", "1"), request.getQueryParams());
    }
}
