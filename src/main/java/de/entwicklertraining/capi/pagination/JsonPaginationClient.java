package de.entwicklertraining.capi.pagination;

import de.entwicklertraining.capi.ApiClient;
import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link PaginationClient} that GETs a v3 list endpoint through {@link ApiClient} and maps each
 * entry of {@code resources} with the given function.
 */
public class JsonPaginationClient<T> implements PaginationClient<T> {

    private final ApiClient client;
    private final Function<JSONObject, T> mapper;

    public JsonPaginationClient(ApiClient client, Function<JSONObject, T> mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    public static JsonPaginationClient<JSONObject> raw(ApiClient client) {
        return new JsonPaginationClient<>(client, Function.identity());
    }

    @Override
    public ListResponse<T> listWithPath(String path, QueryParams params, CancellationToken cancellationToken) {
        ApiRequest request = ApiRequest.builder("GET", path)
                .queryParams(params == null ? Map.of() : params.toMap())
                .build();
        ApiResponse response = client.execute(request, cancellationToken);
        return parse(response.getBodyAsString(), mapper);
    }

    static <T> ListResponse<T> parse(String body, Function<JSONObject, T> mapper) {
        JSONObject json = new JSONObject(body);
        Pagination pagination = Pagination.fromJson(json.optJSONObject("pagination"));
        JSONArray resources = json.optJSONArray("resources");
        List<T> items = new ArrayList<>();
        if (resources != null) {
            for (int i = 0; i < resources.length(); i++) {
                items.add(mapper.apply(resources.getJSONObject(i)));
            }
        }
        return new ListResponse<>(pagination, items);
    }
}
