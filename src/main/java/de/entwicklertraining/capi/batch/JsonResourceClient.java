package de.entwicklertraining.capi.batch;

import de.entwicklertraining.capi.ApiClient;
import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import org.json.JSONObject;

/**
 * {@link ResourceClient} for a v3 collection that speaks plain {@link JSONObject}s.
 * <p>
 * Deletes answer with the job URL from the {@code Location} header, or {@code null} when the
 * platform deleted synchronously.
 */
public class JsonResourceClient implements ResourceClient<JSONObject, JSONObject, JSONObject> {

    private final ApiClient client;
    private final String collectionPath;

    /**
     * @param collectionPath e.g. {@code /v3/apps}
     */
    public JsonResourceClient(ApiClient client, String collectionPath) {
        this.client = client;
        this.collectionPath = collectionPath;
    }

    public String getCollectionPath() {
        return collectionPath;
    }

    @Override
    public JSONObject create(JSONObject request, CancellationToken cancellationToken) {
        return parse(client.execute(ApiRequest.post(collectionPath, request.toString()), cancellationToken));
    }

    @Override
    public JSONObject update(String guid, JSONObject request, CancellationToken cancellationToken) {
        return parse(client.execute(ApiRequest.patch(itemPath(guid), request.toString()), cancellationToken));
    }

    @Override
    public Object delete(String guid, CancellationToken cancellationToken) {
        ApiResponse response = client.execute(ApiRequest.delete(itemPath(guid)), cancellationToken);
        return response.getHeader("Location").orElse(null);
    }

    @Override
    public JSONObject get(String guid, CancellationToken cancellationToken) {
        return parse(client.execute(ApiRequest.get(itemPath(guid)), cancellationToken));
    }

    private String itemPath(String guid) {
        return collectionPath + "/" + guid;
    }

    private static JSONObject parse(ApiResponse response) {
        String body = response.getBodyAsString();
        if (body == null || body.isBlank()) {
            return new JSONObject();
        }
        return new JSONObject(body);
    }
}
