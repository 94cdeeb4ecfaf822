package de.entwicklertraining.capi.batch;

import de.entwicklertraining.capi.cancellation.CancellationToken;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Binds a resource tag to a {@link ResourceClient} and checks payload types before dispatch.
 *
 * @param <C> create request type
 * @param <U> update request type
 * @param <R> resource type
 */
public final class ResourceDescriptor<C, U, R> {

    private final String name;
    private final Class<C> createType;
    private final Class<U> updateType;
    private final Class<R> resourceType;
    private final ResourceClient<C, U, R> client;
    private final Function<R, String> guidExtractor;

    /**
     * @param guidExtractor reads the GUID of a created resource, used to roll creates back
     */
    public ResourceDescriptor(String name, Class<C> createType, Class<U> updateType, Class<R> resourceType,
                              ResourceClient<C, U, R> client, Function<R, String> guidExtractor) {
        this.name = Objects.requireNonNull(name, "name");
        this.createType = createType;
        this.updateType = updateType;
        this.resourceType = resourceType;
        this.client = client;
        this.guidExtractor = guidExtractor;
    }

    public String getName() {
        return name;
    }

    /**
     * Runs {@code type} with the given payload.
     *
     * @throws BatchOperationException if the payload does not fit the verb
     */
    public Object execute(OperationType type, Object data, CancellationToken cancellationToken) {
        switch (type) {
            case CREATE:
                if (!createType.isInstance(data)) {
                    throw invalidData(type);
                }
                return client.create(createType.cast(data), cancellationToken);
            case UPDATE:
                if (!(data instanceof UpdatePayload<?> payload) || !updateType.isInstance(payload.request())) {
                    throw invalidData(type);
                }
                return client.update(payload.guid(), updateType.cast(payload.request()), cancellationToken);
            case DELETE:
                if (!(data instanceof String guid)) {
                    throw invalidData(type);
                }
                return client.delete(guid, cancellationToken);
            case GET:
                if (!(data instanceof String guid)) {
                    throw invalidData(type);
                }
                return client.get(guid, cancellationToken);
            default:
                throw new BatchOperationException("unsupported operation type: " + type.getValue());
        }
    }

    /**
     * GUID of a resource returned by a create, empty if it cannot be determined.
     */
    public Optional<String> guidOf(Object created) {
        if (guidExtractor == null || !resourceType.isInstance(created)) {
            return Optional.empty();
        }
        return Optional.ofNullable(guidExtractor.apply(resourceType.cast(created))).filter(s -> !s.isEmpty());
    }

    private BatchOperationException invalidData(OperationType type) {
        return new BatchOperationException("invalid data type for " + name + " operation " + type.getValue());
    }
}
