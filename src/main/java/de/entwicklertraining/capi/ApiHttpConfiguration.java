package de.entwicklertraining.capi;

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Configuration for HTTP transport layer concerns including default headers and request modification.
 * Values here apply to every call the {@link ApiClient} sends; headers set on an individual
 * {@link ApiRequest} (or by an interceptor) take precedence.
 * <p>
 * Example usage:
 * <pre>
 * ApiHttpConfiguration httpConfig = ApiHttpConfiguration.builder()
 *     .userAgent("capi-java/1.0")
 *     .header("X-Custom-Header", "value")
 *     .requestModifier(builder -> builder.header("X-Request-ID", UUID.randomUUID().toString()))
 *     .build();
 * </pre>
 */
public class ApiHttpConfiguration {

    public static final String DEFAULT_ACCEPT = "application/json";

    /** Headers added to all requests */
    private final Map<String, String> globalHeaders;

    /** Modifiers applied to every {@link HttpRequest.Builder} right before sending */
    private final List<Consumer<HttpRequest.Builder>> requestModifiers;

    private final String userAgent;

    /**
     * Creates a new instance with empty configuration.
     */
    public ApiHttpConfiguration() {
        this(new Builder());
    }

    private ApiHttpConfiguration(Builder builder) {
        this.globalHeaders = Map.copyOf(builder.globalHeaders);
        this.requestModifiers = List.copyOf(builder.requestModifiers);
        this.userAgent = builder.userAgent;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a new Builder pre-populated with the current configuration.
     *
     * @return A new Builder instance with current configuration
     */
    public Builder toBuilder() {
        return new Builder()
                .headers(globalHeaders)
                .requestModifiers(requestModifiers)
                .userAgent(userAgent);
    }

    public Map<String, String> getGlobalHeaders() {
        return globalHeaders;
    }

    public List<Consumer<HttpRequest.Builder>> getRequestModifiers() {
        return requestModifiers;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public static class Builder {
        private final Map<String, String> globalHeaders = new HashMap<>();
        private final List<Consumer<HttpRequest.Builder>> requestModifiers = new ArrayList<>();
        private String userAgent = "capi-client-pipeline/1.0";

        public Builder() {
        }

        /**
         * Adds a header that is sent with every request.
         *
         * @param name  header name
         * @param value header value
         * @return This builder for method chaining
         */
        public Builder header(String name, String value) {
            globalHeaders.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            globalHeaders.putAll(headers);
            return this;
        }

        /**
         * Adds a modifier that can change the {@link HttpRequest.Builder} before the request is sent.
         *
         * @param modifier the modifier
         * @return This builder for method chaining
         */
        public Builder requestModifier(Consumer<HttpRequest.Builder> modifier) {
            requestModifiers.add(modifier);
            return this;
        }

        public Builder requestModifiers(List<Consumer<HttpRequest.Builder>> modifiers) {
            requestModifiers.addAll(modifiers);
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public ApiHttpConfiguration build() {
            return new ApiHttpConfiguration(this);
        }
    }
}
