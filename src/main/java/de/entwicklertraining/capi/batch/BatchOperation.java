package de.entwicklertraining.capi.batch;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * One unit of work in a batch.
 * <p>
 * The payload depends on the verb: a create request for {@code create}, an {@link UpdatePayload}
 * for {@code update} and the resource GUID as {@link String} for {@code delete} and {@code get}.
 *
 * @param id       caller-chosen identifier, echoed in the {@link BatchResult}
 * @param type     verb, see {@link OperationType}
 * @param resource resource tag, e.g. {@code app}
 * @param data     verb-specific payload
 * @param callback invoked once with the final result, may be {@code null}
 */
public record BatchOperation(String id, String type, String resource, Object data, Consumer<BatchResult> callback) {

    public BatchOperation {
        Objects.requireNonNull(id, "id");
    }

    public BatchOperation(String id, String type, String resource, Object data) {
        this(id, type, resource, data, null);
    }

    public static BatchOperation create(String id, String resource, Object request) {
        return new BatchOperation(id, OperationType.CREATE.getValue(), resource, request);
    }

    public static BatchOperation update(String id, String resource, String guid, Object request) {
        return new BatchOperation(id, OperationType.UPDATE.getValue(), resource, new UpdatePayload<>(guid, request));
    }

    public static BatchOperation delete(String id, String resource, String guid) {
        return new BatchOperation(id, OperationType.DELETE.getValue(), resource, guid);
    }

    public static BatchOperation get(String id, String resource, String guid) {
        return new BatchOperation(id, OperationType.GET.getValue(), resource, guid);
    }

    public BatchOperation withCallback(Consumer<BatchResult> callback) {
        return new BatchOperation(id, type, resource, data, callback);
    }
}
