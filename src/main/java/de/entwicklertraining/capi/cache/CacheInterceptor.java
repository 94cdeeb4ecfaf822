package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import de.entwicklertraining.capi.interceptor.RequestInterceptor;
import de.entwicklertraining.capi.interceptor.ResponseInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Serves GET requests from the cache and stores cacheable responses.
 * <p>
 * A fresh entry answers the request without a transport call; the response is marked
 * {@link ApiResponse#isFromCache() from cache}. {@code Cache-Control: no-cache} on the request
 * skips the lookup. Cacheable 2xx responses up to {@link #MAX_CACHE_VALUE_SIZE} bytes are stored
 * together with their ETag. Cache failures are logged and never fail the request.
 */
public class CacheInterceptor implements RequestInterceptor, ResponseInterceptor {
    private static final Logger logger = LoggerFactory.getLogger(CacheInterceptor.class.getName());

    public static final int MAX_CACHE_VALUE_SIZE = 1024 * 1024;
    public static final String CACHE_STATUS_HEADER = "X-Cache";
    public static final String STATUS_HIT = "HIT";
    public static final String STATUS_MISS = "MISS";
    public static final String STATUS_REVALIDATED = "REVALIDATED";

    private final CacheManager manager;
    private final CachingPolicy policy;
    private final Function<String, Duration> ttlResolver;
    private final CacheInvalidationInterceptor invalidation;
    private final boolean markCacheStatus;

    public CacheInterceptor(CacheManager manager, CachingPolicy policy) {
        this(manager, policy, path -> null, true, false);
    }

    /**
     * @param ttlResolver     TTL per path; {@code null} results mean the manager's default TTL
     * @param invalidate      whether successful mutations invalidate related entries
     * @param markCacheStatus whether responses get an {@value #CACHE_STATUS_HEADER} header
     */
    public CacheInterceptor(CacheManager manager, CachingPolicy policy, Function<String, Duration> ttlResolver,
                            boolean invalidate, boolean markCacheStatus) {
        this.manager = manager;
        this.policy = policy;
        this.ttlResolver = ttlResolver;
        this.invalidation = invalidate ? new CacheInvalidationInterceptor(manager) : null;
        this.markCacheStatus = markCacheStatus;
    }

    @Override
    public void onRequest(ApiRequest request, CancellationToken cancellationToken) {
        if (!policy.isReadable(request.getMethod(), request.getPath()) || isNoCache(request)) {
            return;
        }
        String key = CacheManager.cacheKey(request);
        Optional<CacheEntry> entry;
        try {
            entry = manager.getEntry(key);
        } catch (RuntimeException e) {
            logger.warn("Cache lookup for {} failed: {}", key, e.getMessage());
            return;
        }
        if (entry.isEmpty()) {
            return;
        }
        ApiResponse cached = new ApiResponse(request, entry.get().statusCode(), Map.of(), entry.get().data());
        cached.setFromCache(true);
        entry.get().getETag().ifPresent(etag -> cached.setHeader("ETag", etag));
        if (markCacheStatus) {
            cached.setHeader(CACHE_STATUS_HEADER, STATUS_HIT);
        }
        request.setShortCircuitResponse(cached);
        logger.debug("Cache hit for {}", key);
    }

    @Override
    public void onResponse(ApiRequest request, ApiResponse response, CancellationToken cancellationToken) {
        if (response.isFromCache() || response.getError().isPresent()) {
            return;
        }
        if (invalidation != null) {
            invalidation.onResponse(request, response, cancellationToken);
        }
        if (!policy.shouldCache(request.getMethod(), request.getPath(), response.getStatusCode())) {
            return;
        }
        if (response.getBody().length > MAX_CACHE_VALUE_SIZE) {
            logger.debug("Response for {} too large to cache ({} bytes)", request, response.getBody().length);
            return;
        }
        String key = CacheManager.cacheKey(request);
        try {
            manager.setResponse(key, response.getBody(), response.getHeader("ETag").orElse(null),
                    response.getStatusCode(), ttlResolver.apply(request.getPath()));
        } catch (RuntimeException e) {
            logger.warn("Could not cache response for {}: {}", key, e.getMessage());
            return;
        }
        if (markCacheStatus && response.getHeader(CACHE_STATUS_HEADER).isEmpty()) {
            response.setHeader(CACHE_STATUS_HEADER, STATUS_MISS);
        }
    }

    private static boolean isNoCache(ApiRequest request) {
        return request.getHeader("Cache-Control")
                .map(value -> value.toLowerCase(Locale.ROOT).contains("no-cache"))
                .orElse(false);
    }
}
