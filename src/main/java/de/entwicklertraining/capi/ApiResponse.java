package de.entwicklertraining.capi;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Result of one execution cycle.
 * <p>
 * A response either carries an HTTP status with headers and body, or a transport
 * {@link #getError() error} with status 0. Response interceptors may mark it as served
 * from cache or as eligible for a retry.
 */
public class ApiResponse {

    /** Header set by the retry interceptor on responses that should be retried. */
    public static final String RETRY_HEADER = "X-Should-Retry";

    private final ApiRequest request;
    private int statusCode;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private byte[] body;
    private Throwable error;
    private boolean fromCache;
    private boolean retryEligible;

    public ApiResponse(ApiRequest request, int statusCode, Map<String, String> headers, byte[] body) {
        this.request = request;
        this.statusCode = statusCode;
        if (headers != null) {
            this.headers.putAll(headers);
        }
        this.body = body == null ? new byte[0] : body;
    }

    /**
     * A response for a call that never produced an HTTP status.
     */
    public static ApiResponse failed(ApiRequest request, Throwable error) {
        ApiResponse response = new ApiResponse(request, 0, Map.of(), new byte[0]);
        response.error = error;
        return response;
    }

    /**
     * Gets the request that produced this response.
     *
     * @return the originating request (never null)
     */
    public ApiRequest getRequest() {
        return request;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public void setStatusCode(int statusCode) {
        this.statusCode = statusCode;
    }

    public boolean isSuccess() {
        return error == null && statusCode >= 200 && statusCode < 300;
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

    public byte[] getBody() {
        return body;
    }

    public void setBody(byte[] body) {
        this.body = body == null ? new byte[0] : body;
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public void setError(Throwable error) {
        this.error = error;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    public void setFromCache(boolean fromCache) {
        this.fromCache = fromCache;
    }

    public boolean isRetryEligible() {
        return retryEligible;
    }

    public void markRetryEligible() {
        this.retryEligible = true;
        headers.put(RETRY_HEADER, "true");
    }

    @Override
    public String toString() {
        return error != null
                ? "ApiResponse{error=" + error.getMessage() + "}"
                : "ApiResponse{status=" + statusCode + ", fromCache=" + fromCache + "}";
    }
}
