package de.entwicklertraining.capi;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable retry policy shared by the retry interceptor (classification) and
 * {@link ApiClient#executeWithRetry} (the retry loop).
 * <p>
 * Defaults: 3 retries, 1 s base delay, 30 s cap, retryable statuses 429, 500, 502, 503 and 504.
 */
public final class RetryConfig {

    public static final Set<Integer> DEFAULT_RETRYABLE_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

    private final int maxRetries;
    private final Duration retryDelay;
    private final Duration maxDelay;
    private final Set<Integer> retryableStatusCodes;

    private RetryConfig(Builder builder) {
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = builder.maxRetries;
        this.retryDelay = Objects.requireNonNull(builder.retryDelay, "retryDelay");
        this.maxDelay = Objects.requireNonNull(builder.maxDelay, "maxDelay");
        this.retryableStatusCodes = Set.copyOf(builder.retryableStatusCodes);
    }

    public static RetryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxRetries(maxRetries)
                .retryDelay(retryDelay)
                .maxDelay(maxDelay)
                .retryableStatusCodes(retryableStatusCodes);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public Set<Integer> getRetryableStatusCodes() {
        return retryableStatusCodes;
    }

    public boolean isRetryable(int statusCode) {
        return retryableStatusCodes.contains(statusCode);
    }

    public static final class Builder {
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private Set<Integer> retryableStatusCodes = DEFAULT_RETRYABLE_STATUS_CODES;

        private Builder() {
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder retryableStatusCodes(Set<Integer> codes) {
            this.retryableStatusCodes = codes;
            return this;
        }

        public RetryConfig build() {
            return new RetryConfig(this);
        }
    }
}
