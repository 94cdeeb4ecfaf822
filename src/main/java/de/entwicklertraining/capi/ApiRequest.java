package de.entwicklertraining.capi;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A single outbound call as seen by the interceptor chain.
 * <p>
 * Requests are mutable so interceptors can attach headers and metadata while the request
 * travels through the request phase. A request belongs to one execution cycle and is not
 * shared between threads.
 *
 * <pre>
 * ApiRequest request = ApiRequest.builder("GET", "/v3/apps")
 *     .queryParam("per_page", "50")
 *     .header("X-Trace", "abc")
 *     .build();
 * </pre>
 */
public class ApiRequest {

    /** Metadata key under which the metrics interceptor stores the start instant. */
    public static final String METADATA_START_TIME = "start_time";

    private final String method;
    private final String path;
    private final Map<String, String> queryParams;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, Object> metadata = new HashMap<>();
    private final byte[] body;
    private final Duration timeout;

    /** Response an interceptor supplied in place of the transport call, e.g. a cache hit. */
    private ApiResponse shortCircuitResponse;

    protected ApiRequest(Builder builder) {
        this.method = builder.method;
        this.path = builder.path;
        this.queryParams = new TreeMap<>(builder.queryParams);
        this.headers.putAll(builder.headers);
        this.body = builder.body;
        this.timeout = builder.timeout;
    }

    public static Builder builder(String method, String path) {
        return new Builder(method, path);
    }

    public static ApiRequest get(String path) {
        return builder("GET", path).build();
    }

    public static ApiRequest delete(String path) {
        return builder("DELETE", path).build();
    }

    public static ApiRequest post(String path, String jsonBody) {
        return builder("POST", path).jsonBody(jsonBody).build();
    }

    public static ApiRequest patch(String path, String jsonBody) {
        return builder("PATCH", path).jsonBody(jsonBody).build();
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    /**
     * Query parameters sorted by name.
     */
    public Map<String, String> getQueryParams() {
        return Collections.unmodifiableMap(queryParams);
    }

    /**
     * Path plus URL-encoded query string.
     */
    public String getRelativeUrl() {
        if (queryParams.isEmpty()) {
            return path;
        }
        String query = queryParams.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        return path + "?" + query;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("%5B", "[")
                .replace("%5D", "]")
                .replace("%2C", ",");
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public Optional<String> getHeader(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public void setHeader(String name, String value) {
        headers.put(name, value);
    }

    public void removeHeader(String name) {
        headers.remove(name);
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    public byte[] getBody() {
        return body == null ? new byte[0] : body.clone();
    }

    public String getBodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Per-request transport timeout, empty to use the client default.
     */
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<Object> getMetadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    public boolean isMutating() {
        return switch (method) {
            case "POST", "PUT", "PATCH", "DELETE" -> true;
            default -> false;
        };
    }

    public Optional<ApiResponse> getShortCircuitResponse() {
        return Optional.ofNullable(shortCircuitResponse);
    }

    /**
     * Answers this request without a transport call. Response interceptors still run.
     */
    public void setShortCircuitResponse(ApiResponse response) {
        this.shortCircuitResponse = response;
    }

    @Override
    public String toString() {
        return method + " " + getRelativeUrl();
    }

    public static class Builder {
        private final String method;
        private final String path;
        private final Map<String, String> queryParams = new TreeMap<>();
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private byte[] body;
        private Duration timeout;

        public Builder(String method, String path) {
            this.method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
            this.path = Objects.requireNonNull(path, "path");
        }

        public Builder queryParam(String name, String value) {
            queryParams.put(name, value);
            return this;
        }

        public Builder queryParams(Map<String, String> params) {
            if (params != null) {
                queryParams.putAll(params);
            }
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body == null ? null : body.clone();
            return this;
        }

        public Builder jsonBody(String json) {
            if (json != null) {
                this.body = json.getBytes(StandardCharsets.UTF_8);
                headers.putIfAbsent("Content-Type", "application/json");
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public ApiRequest build() {
            return new ApiRequest(this);
        }
    }
}
