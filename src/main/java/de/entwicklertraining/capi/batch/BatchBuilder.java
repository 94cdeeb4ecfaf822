package de.entwicklertraining.capi.batch;

import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Fluent accumulation of {@link BatchOperation}s.
 */
public class BatchBuilder {

    private final List<BatchOperation> operations = new ArrayList<>();

    public BatchBuilder add(BatchOperation operation) {
        operations.add(operation);
        return this;
    }

    public BatchBuilder addCreate(String id, String resource, Object request) {
        return add(BatchOperation.create(id, resource, request));
    }

    public BatchBuilder addUpdate(String id, String resource, String guid, Object request) {
        return add(BatchOperation.update(id, resource, guid, request));
    }

    public BatchBuilder addDelete(String id, String resource, String guid) {
        return add(BatchOperation.delete(id, resource, guid));
    }

    public BatchBuilder addGet(String id, String resource, String guid) {
        return add(BatchOperation.get(id, resource, guid));
    }

    public BatchBuilder addCreateApp(String id, JSONObject request) {
        return addCreate(id, ResourceRegistry.APP, request);
    }

    public BatchBuilder addUpdateApp(String id, String guid, JSONObject request) {
        return addUpdate(id, ResourceRegistry.APP, guid, request);
    }

    public BatchBuilder addDeleteApp(String id, String guid) {
        return addDelete(id, ResourceRegistry.APP, guid);
    }

    public BatchBuilder addGetApp(String id, String guid) {
        return addGet(id, ResourceRegistry.APP, guid);
    }

    public BatchBuilder addCreateSpace(String id, JSONObject request) {
        return addCreate(id, ResourceRegistry.SPACE, request);
    }

    public BatchBuilder addUpdateSpace(String id, String guid, JSONObject request) {
        return addUpdate(id, ResourceRegistry.SPACE, guid, request);
    }

    public BatchBuilder addDeleteSpace(String id, String guid) {
        return addDelete(id, ResourceRegistry.SPACE, guid);
    }

    public BatchBuilder addCreateOrganization(String id, JSONObject request) {
        return addCreate(id, ResourceRegistry.ORGANIZATION, request);
    }

    public List<BatchOperation> build() {
        return List.copyOf(operations);
    }
}
