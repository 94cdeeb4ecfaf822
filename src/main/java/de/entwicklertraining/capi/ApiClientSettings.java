package de.entwicklertraining.capi;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration settings for {@link ApiClient} behavior: retry policy, backoff shape and timeouts.
 * This class provides a fluent builder API and sensible defaults for all settings.
 * <p>
 * Example usage:
 * <pre>
 * ApiClientSettings settings = ApiClientSettings.builder()
 *     .retryConfig(RetryConfig.builder().maxRetries(5).build())
 *     .exponentialBase(2.0)
 *     .useJitter(true)
 *     .requestTimeout(Duration.ofSeconds(30))
 *     .build();
 * </pre>
 */
public final class ApiClientSettings {

    /** Retry count, base delay, delay cap and retryable statuses */
    private final RetryConfig retryConfig;

    /** Base multiplier for exponential backoff calculation */
    private final double exponentialBase;

    /** Whether to add random jitter to backoff delays to prevent thundering herd */
    private final boolean useJitter;

    /** Upper bound for a single transport call; zero disables the bound */
    private final Duration requestTimeout;

    /** Connect timeout handed to the underlying HttpClient */
    private final Duration connectTimeout;

    /**
     * Private constructor used by the Builder.
     *
     * @param builder The builder containing all configuration values
     */
    private ApiClientSettings(Builder builder) {
        this.retryConfig = Objects.requireNonNull(builder.retryConfig, "retryConfig");
        this.exponentialBase = builder.exponentialBase;
        this.useJitter = builder.useJitter;
        this.requestTimeout = Objects.requireNonNull(builder.requestTimeout, "requestTimeout");
        this.connectTimeout = Objects.requireNonNull(builder.connectTimeout, "connectTimeout");
    }

    /**
     * Settings with every value at its default.
     */
    public static ApiClientSettings defaults() {
        return builder().build();
    }

    /**
     * Creates a new Builder for constructing ApiClientSettings instances.
     *
     * @return A new Builder instance with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a new Builder pre-populated with the current settings.
     * Useful for creating a modified copy of an existing configuration.
     *
     * @return A new Builder instance with current settings
     */
    public Builder toBuilder() {
        return new Builder()
                .retryConfig(retryConfig)
                .exponentialBase(exponentialBase)
                .useJitter(useJitter)
                .requestTimeout(requestTimeout)
                .connectTimeout(connectTimeout);
    }

    public RetryConfig getRetryConfig() {
        return retryConfig;
    }

    /**
     * Gets the base multiplier for exponential backoff.
     *
     * @return The exponential base (e.g., 2.0 for doubling)
     */
    public double getExponentialBase() {
        return exponentialBase;
    }

    /**
     * Checks if jitter is enabled for backoff delays.
     *
     * @return true if jitter is enabled, false otherwise
     */
    public boolean isUseJitter() {
        return useJitter;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * Builder for creating immutable {@link ApiClientSettings} instances.
     * Provides a fluent API for configuration with method chaining.
     */
    public static final class Builder {
        private RetryConfig retryConfig = RetryConfig.defaults();
        private double exponentialBase = 2.0;
        private boolean useJitter = true;
        private Duration requestTimeout = Duration.ofSeconds(60);
        private Duration connectTimeout = Duration.ofSeconds(10);

        private Builder() {
        }

        public Builder retryConfig(RetryConfig retryConfig) {
            this.retryConfig = retryConfig;
            return this;
        }

        /**
         * Sets the base multiplier for exponential backoff.
         *
         * @param exponentialBase Base multiplier (must be >= 1.0)
         * @return This builder for method chaining
         */
        public Builder exponentialBase(double exponentialBase) {
            if (exponentialBase < 1.0) {
                throw new IllegalArgumentException("exponentialBase must be >= 1.0");
            }
            this.exponentialBase = exponentialBase;
            return this;
        }

        /**
         * Enables or disables jitter for backoff delays.
         *
         * @param useJitter true to enable jitter, false to disable
         * @return This builder for method chaining
         */
        public Builder useJitter(boolean useJitter) {
            this.useJitter = useJitter;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        /**
         * Builds a new ApiClientSettings instance with the current builder values.
         *
         * @return A new ApiClientSettings instance
         */
        public ApiClientSettings build() {
            return new ApiClientSettings(this);
        }
    }
}
