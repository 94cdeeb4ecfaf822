package de.entwicklertraining.capi.batch;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchBuilderTest {

    @Test
    void testBuildsTypedOperations() {
        JSONObject app = new JSONObject().put("name", "web");
        List<BatchOperation> ops = new BatchBuilder()
                .addCreateApp("c", app)
                .addUpdateSpace("u", "space-guid", new JSONObject().put("name", "dev"))
                .addDeleteApp("d", "app-guid")
                .addGet("g", ResourceRegistry.ROUTE, "route-guid")
                .addCreateOrganization("o", new JSONObject().put("name", "org"))
                .build();

        assertEquals(5, ops.size());
        assertEquals(new BatchOperation("c", "create", "app", app), ops.get(0));

        BatchOperation update = ops.get(1);
        assertEquals("update", update.type());
        assertEquals("space", update.resource());
        UpdatePayload<?> payload = assertInstanceOf(UpdatePayload.class, update.data());
        assertEquals("space-guid", payload.guid());

        assertEquals("app-guid", ops.get(2).data());
        assertEquals("route", ops.get(3).resource());
        assertEquals("organization", ops.get(4).resource());
        assertNull(ops.get(0).callback());
    }

    @Test
    void testBuiltListIsImmutable() {
        List<BatchOperation> ops = new BatchBuilder().addDeleteSpace("d", "g").build();

        assertThrows(UnsupportedOperationException.class, () -> ops.add(BatchOperation.get("x", "app", "g")));
    }

    @Test
    void testOperationRequiresId() {
        assertThrows(NullPointerException.class, () -> BatchOperation.get(null, "app", "g"));
    }

    @Test
    void testOperationTypeLookup() {
        assertEquals(OperationType.DELETE, OperationType.fromValue("delete").orElseThrow());
        assertTrue(OperationType.fromValue("restart").isEmpty());
    }
}
