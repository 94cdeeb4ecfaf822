package de.entwicklertraining.capi.circuit;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds of a {@link CircuitBreaker}.
 * <p>
 * Defaults: open after 5 failures, stay open for 30 s, close after 2 successful probes.
 */
public final class CircuitBreakerConfig {

    private final int failureThreshold;
    private final Duration timeout;
    private final int successThreshold;

    private CircuitBreakerConfig(Builder builder) {
        if (builder.failureThreshold < 1 || builder.successThreshold < 1) {
            throw new IllegalArgumentException("thresholds must be >= 1");
        }
        this.failureThreshold = builder.failureThreshold;
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
        this.successThreshold = builder.successThreshold;
    }

    public static CircuitBreakerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    /**
     * How long the breaker stays open after the last failure before it lets a probe through.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public int getSuccessThreshold() {
        return successThreshold;
    }

    public static final class Builder {
        private int failureThreshold = 5;
        private Duration timeout = Duration.ofSeconds(30);
        private int successThreshold = 2;

        private Builder() {
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder successThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
            return this;
        }

        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(this);
        }
    }
}
