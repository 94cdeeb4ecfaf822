package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.RetryConfig;

import java.util.List;
import java.util.Locale;

/**
 * Decides which responses may be stored.
 * <p>
 * The default policy caches successful GET responses for every path except job and deployment
 * resources, whose state changes too quickly to be served from a cache.
 */
public final class CachingPolicy {

    public static final List<String> DEFAULT_EXCLUDE_PATHS = List.of("/v3/jobs", "/v3/deployments");

    private final boolean cacheGet;
    private final boolean cachePost;
    private final boolean cacheErrors;
    private final List<String> includePaths;
    private final List<String> excludePaths;

    private CachingPolicy(Builder builder) {
        this.cacheGet = builder.cacheGet;
        this.cachePost = builder.cachePost;
        this.cacheErrors = builder.cacheErrors;
        this.includePaths = List.copyOf(builder.includePaths);
        this.excludePaths = List.copyOf(builder.excludePaths);
    }

    public static CachingPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .cacheGet(cacheGet)
                .cachePost(cachePost)
                .cacheErrors(cacheErrors)
                .includePaths(includePaths)
                .excludePaths(excludePaths);
    }

    /**
     * @return {@code true} if a response with this method, path and status may be cached
     */
    public boolean shouldCache(String method, String path, int statusCode) {
        if (matchesAny(excludePaths, path)) {
            return false;
        }
        if (!includePaths.isEmpty() && !matchesAny(includePaths, path)) {
            return false;
        }
        boolean methodAllowed = switch (method.toUpperCase(Locale.ROOT)) {
            case "GET" -> cacheGet;
            case "POST" -> cachePost;
            default -> false;
        };
        if (!methodAllowed) {
            return false;
        }
        if (statusCode >= 200 && statusCode < 300) {
            return true;
        }
        // client errors are stable enough to cache on request, server errors and throttling never are
        return cacheErrors && statusCode >= 400 && statusCode < 500
                && !RetryConfig.DEFAULT_RETRYABLE_STATUS_CODES.contains(statusCode);
    }

    /**
     * @return {@code true} if a GET for this path may be answered from the cache
     */
    public boolean isReadable(String method, String path) {
        return "GET".equalsIgnoreCase(method) && shouldCache(method, path, 200);
    }

    private static boolean matchesAny(List<String> prefixes, String path) {
        for (String prefix : prefixes) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    public boolean isCacheGet() {
        return cacheGet;
    }

    public boolean isCachePost() {
        return cachePost;
    }

    public boolean isCacheErrors() {
        return cacheErrors;
    }

    public List<String> getIncludePaths() {
        return includePaths;
    }

    public List<String> getExcludePaths() {
        return excludePaths;
    }

    public static final class Builder {
        private boolean cacheGet = true;
        private boolean cachePost = false;
        private boolean cacheErrors = false;
        private List<String> includePaths = List.of();
        private List<String> excludePaths = DEFAULT_EXCLUDE_PATHS;

        private Builder() {
        }

        public Builder cacheGet(boolean cacheGet) {
            this.cacheGet = cacheGet;
            return this;
        }

        public Builder cachePost(boolean cachePost) {
            this.cachePost = cachePost;
            return this;
        }

        public Builder cacheErrors(boolean cacheErrors) {
            this.cacheErrors = cacheErrors;
            return this;
        }

        /**
         * Restricts caching to these path prefixes. Empty means every path.
         */
        public Builder includePaths(List<String> includePaths) {
            this.includePaths = includePaths;
            return this;
        }

        public Builder excludePaths(List<String> excludePaths) {
            this.excludePaths = excludePaths;
            return this;
        }

        public CachingPolicy build() {
            return new CachingPolicy(this);
        }
    }
}
