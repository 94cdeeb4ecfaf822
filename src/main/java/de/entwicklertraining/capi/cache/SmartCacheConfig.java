package de.entwicklertraining.capi.cache;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for {@link SmartCache#configure}: which cache features are active and how long
 * entries of each resource live.
 */
public final class SmartCacheConfig {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final boolean enableSmartInvalidation;
    private final boolean enableConditionalRequests;
    private final boolean enableMetrics;
    private final Duration defaultTtl;
    private final Map<String, Duration> resourceTtls;
    private final CachingPolicy policy;

    private SmartCacheConfig(Builder builder) {
        this.enableSmartInvalidation = builder.enableSmartInvalidation;
        this.enableConditionalRequests = builder.enableConditionalRequests;
        this.enableMetrics = builder.enableMetrics;
        this.defaultTtl = builder.defaultTtl;
        this.resourceTtls = Map.copyOf(builder.resourceTtls);
        this.policy = builder.policy;
    }

    public static SmartCacheConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the TTL for a path by the longest configured prefix, falling back to the default TTL.
     */
    public Duration ttlFor(String path) {
        Duration best = defaultTtl;
        int bestLength = -1;
        for (Map.Entry<String, Duration> entry : resourceTtls.entrySet()) {
            String prefix = entry.getKey();
            boolean matches = path.equals(prefix) || path.startsWith(prefix + "/");
            if (matches && prefix.length() > bestLength) {
                best = entry.getValue();
                bestLength = prefix.length();
            }
        }
        return best;
    }

    public boolean isEnableSmartInvalidation() {
        return enableSmartInvalidation;
    }

    public boolean isEnableConditionalRequests() {
        return enableConditionalRequests;
    }

    public boolean isEnableMetrics() {
        return enableMetrics;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public Map<String, Duration> getResourceTtls() {
        return resourceTtls;
    }

    public CachingPolicy getPolicy() {
        return policy;
    }

    public static final class Builder {
        private boolean enableSmartInvalidation = true;
        private boolean enableConditionalRequests = true;
        private boolean enableMetrics = true;
        private Duration defaultTtl = DEFAULT_TTL;
        private final Map<String, Duration> resourceTtls = new LinkedHashMap<>();
        private CachingPolicy policy = CachingPolicy.defaults();

        private Builder() {
            resourceTtls.put("/v3/organizations", Duration.ofMinutes(10));
            resourceTtls.put("/v3/spaces", Duration.ofMinutes(5));
            resourceTtls.put("/v3/apps", Duration.ofMinutes(2));
            resourceTtls.put("/v3/tasks", Duration.ofSeconds(30));
        }

        public Builder enableSmartInvalidation(boolean enable) {
            this.enableSmartInvalidation = enable;
            return this;
        }

        public Builder enableConditionalRequests(boolean enable) {
            this.enableConditionalRequests = enable;
            return this;
        }

        public Builder enableMetrics(boolean enable) {
            this.enableMetrics = enable;
            return this;
        }

        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder resourceTtl(String pathPrefix, Duration ttl) {
            resourceTtls.put(pathPrefix, ttl);
            return this;
        }

        public Builder policy(CachingPolicy policy) {
            this.policy = policy;
            return this;
        }

        public SmartCacheConfig build() {
            return new SmartCacheConfig(this);
        }
    }
}
