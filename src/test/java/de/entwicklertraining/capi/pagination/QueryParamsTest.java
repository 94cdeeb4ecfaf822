package de.entwicklertraining.capi.pagination;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryParamsTest {

    @Test
    void testEmptyParamsProduceNoQuery() {
        assertTrue(QueryParams.create().toMap().isEmpty());
        assertNull(QueryParams.create().getInclude());
    }

    @Test
    void testAllParameters() {
        QueryParams params = QueryParams.create()
                .withPage(2)
                .withPerPage(100)
                .withOrderBy("-created_at")
                .withLabelSelector("env=prod")
                .withInclude("space")
                .withInclude("space.organization")
                .withFields("space", "name", "guid")
                .withFilter("names", "app1", "app2");

        Map<String, String> map = params.toMap();

        assertEquals("2", map.get("page"));
        assertEquals("100", map.get("per_page"));
        assertEquals("-created_at", map.get("order_by"));
        assertEquals("env=prod", map.get("label_selector"));
        assertEquals("space,space.organization", map.get("include"));
        assertEquals("name,guid", map.get("fields[space]"));
        assertEquals("app1,app2", map.get("names"));
        assertEquals(7, map.size());
    }

    @Test
    void testFieldsReplaceAndFiltersAppend() {
        QueryParams params = QueryParams.create()
                .withFields("space", "name")
                .withFields("space", "guid")
                .withFilter("states", "STARTED")
                .withFilter("states", "STOPPED");

        assertEquals(List.of("guid"), params.getFields().get("space"));
        assertEquals("STARTED,STOPPED", params.toMap().get("states"));
    }

    @Test
    void testCopyWithPageIsIndependent() {
        QueryParams original = QueryParams.create().withPerPage(10).withFilter("names", "a");

        QueryParams copy = original.copyWithPage(3);
        copy.withFilter("names", "b");

        assertEquals(3, copy.getPage());
        assertEquals(0, original.getPage());
        assertEquals("a", original.toMap().get("names"));
        assertEquals("a,b", copy.toMap().get("names"));
        assertEquals("10", copy.toMap().get("per_page"));
    }
}
