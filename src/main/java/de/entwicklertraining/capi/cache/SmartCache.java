package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.interceptor.InterceptorChain;

/**
 * Registers the caching interceptors on a chain according to a {@link SmartCacheConfig}.
 */
public final class SmartCache {

    private SmartCache() {
    }

    /**
     * Adds conditional revalidation (if enabled) and the cache interceptor, with per-resource TTLs
     * and, if enabled, invalidation on successful mutations.
     *
     * @return the registered cache interceptor
     */
    public static CacheInterceptor configure(InterceptorChain chain, CacheManager manager, SmartCacheConfig config) {
        SmartCacheConfig effective = config == null ? SmartCacheConfig.defaults() : config;
        CacheInterceptor cacheInterceptor = new CacheInterceptor(manager, effective.getPolicy(), effective::ttlFor,
                effective.isEnableSmartInvalidation(), effective.isEnableMetrics());

        if (effective.isEnableConditionalRequests()) {
            ConditionalRequestInterceptor conditional = new ConditionalRequestInterceptor(manager);
            chain.addRequestInterceptor(conditional);
            chain.addResponseInterceptor(conditional);
        }
        chain.addRequestInterceptor(cacheInterceptor);
        chain.addResponseInterceptor(cacheInterceptor);
        return cacheInterceptor;
    }
}
