package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.ApiClient;
import de.entwicklertraining.capi.ApiClientException;
import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.cancellation.CancellationException;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Pre-populates the cache by issuing GET requests for a list of paths.
 * <p>
 * Each path is fetched with {@code Cache-Control: no-cache} so stale entries are replaced, and
 * the response is stored under the same key the {@link CacheInterceptor} would use. Paths that
 * fail are logged and skipped.
 */
public class CacheWarmer {
    private static final Logger logger = LoggerFactory.getLogger(CacheWarmer.class.getName());

    private final ApiClient client;
    private final CacheManager manager;
    private final Function<String, Duration> ttlResolver;

    public CacheWarmer(ApiClient client, CacheManager manager) {
        this(client, manager, path -> null);
    }

    public CacheWarmer(ApiClient client, CacheManager manager, Function<String, Duration> ttlResolver) {
        this.client = client;
        this.manager = manager;
        this.ttlResolver = ttlResolver;
    }

    /**
     * @return the number of paths whose response is now cached
     * @throws CancellationException if the token fires between paths
     */
    public int warm(List<String> paths, CancellationToken cancellationToken) {
        int warmed = 0;
        for (String path : paths) {
            cancellationToken.throwIfCancelled();
            ApiRequest request = ApiRequest.builder("GET", path).header("Cache-Control", "no-cache").build();
            try {
                ApiResponse response = client.execute(request, cancellationToken);
                if (response.getBody().length > CacheInterceptor.MAX_CACHE_VALUE_SIZE) {
                    logger.debug("Skipping {} for warm-up, response too large", path);
                    continue;
                }
                manager.setResponse(CacheManager.cacheKey(request), response.getBody(),
                        response.getHeader("ETag").orElse(null), response.getStatusCode(), ttlResolver.apply(path));
                warmed++;
            } catch (ApiClientException e) {
                logger.warn("Cache warm-up failed for {}: {}", path, e.getMessage());
            }
        }
        logger.debug("Warmed {} of {} paths", warmed, paths.size());
        return warmed;
    }
}
