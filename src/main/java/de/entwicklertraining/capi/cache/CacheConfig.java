package de.entwicklertraining.capi.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Backend selection for {@link CacheFactory}.
 * <p>
 * Example usage:
 * <pre>
 * Cache cache = CacheConfig.builder()
 *     .type(CacheType.MEMORY)
 *     .memory(50, Duration.ofSeconds(30))
 *     .build()
 *     .create();
 * </pre>
 */
public final class CacheConfig {

    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(1);

    private final CacheType type;
    private final int maxSize;
    private final Duration cleanupInterval;
    private final CacheOptions options;

    private CacheConfig(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type");
        this.maxSize = builder.maxSize;
        this.cleanupInterval = builder.cleanupInterval;
        this.options = builder.options == null ? CacheOptions.defaults() : builder.options;
    }

    public static CacheConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public CacheType getType() {
        return type;
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Interval of the background cleanup; {@code null} or zero disables it.
     */
    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public CacheOptions getOptions() {
        return options;
    }

    /**
     * Shortcut for {@link CacheFactory#create(CacheConfig)}.
     */
    public Cache create() {
        return CacheFactory.create(this);
    }

    public static final class Builder {
        private CacheType type = CacheType.MEMORY;
        private int maxSize = MemoryCache.DEFAULT_MAX_SIZE;
        private Duration cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
        private CacheOptions options;

        private Builder() {
        }

        public Builder type(CacheType type) {
            this.type = type;
            return this;
        }

        public Builder memory(int maxSize, Duration cleanupInterval) {
            this.maxSize = maxSize;
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        public Builder options(CacheOptions options) {
            this.options = options;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(this);
        }
    }
}
