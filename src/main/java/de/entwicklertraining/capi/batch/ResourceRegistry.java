package de.entwicklertraining.capi.batch;

import de.entwicklertraining.capi.ApiClient;
import org.json.JSONObject;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup from resource tag to {@link ResourceDescriptor}.
 */
public class ResourceRegistry {

    public static final String APP = "app";
    public static final String SPACE = "space";
    public static final String ORGANIZATION = "organization";
    public static final String ROUTE = "route";
    public static final String SERVICE_INSTANCE = "service_instance";

    private final Map<String, ResourceDescriptor<?, ?, ?>> descriptors = new ConcurrentHashMap<>();

    public ResourceRegistry register(ResourceDescriptor<?, ?, ?> descriptor) {
        descriptors.put(descriptor.getName(), descriptor);
        return this;
    }

    public Optional<ResourceDescriptor<?, ?, ?>> find(String resource) {
        return resource == null ? Optional.empty() : Optional.ofNullable(descriptors.get(resource));
    }

    /**
     * @throws BatchOperationException if no descriptor is registered for {@code resource}
     */
    public ResourceDescriptor<?, ?, ?> require(String resource) {
        return find(resource).orElseThrow(() -> new BatchOperationException("unsupported resource type: " + resource));
    }

    public Set<String> resources() {
        return Set.copyOf(descriptors.keySet());
    }

    /**
     * Registry with JSON clients for apps, spaces, organizations, routes and service instances.
     */
    public static ResourceRegistry standard(ApiClient client) {
        return new ResourceRegistry()
                .register(json(APP, new JsonResourceClient(client, "/v3/apps")))
                .register(json(SPACE, new JsonResourceClient(client, "/v3/spaces")))
                .register(json(ORGANIZATION, new JsonResourceClient(client, "/v3/organizations")))
                .register(json(ROUTE, new JsonResourceClient(client, "/v3/routes")))
                .register(json(SERVICE_INSTANCE, new JsonResourceClient(client, "/v3/service_instances")));
    }

    public static ResourceDescriptor<JSONObject, JSONObject, JSONObject> json(
            String name, ResourceClient<JSONObject, JSONObject, JSONObject> client) {
        return new ResourceDescriptor<>(name, JSONObject.class, JSONObject.class, JSONObject.class,
                client, resource -> resource.optString("guid", null));
    }
}
