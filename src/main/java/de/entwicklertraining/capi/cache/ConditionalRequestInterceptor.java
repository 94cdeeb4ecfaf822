package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import de.entwicklertraining.capi.interceptor.RequestInterceptor;
import de.entwicklertraining.capi.interceptor.ResponseInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Revalidates cached GET responses with the server.
 * <p>
 * Requests get {@code If-None-Match} with the stored ETag, also after the entry expired. A
 * {@code 304 Not Modified} answer is turned into a 200 carrying the cached payload.
 */
public class ConditionalRequestInterceptor implements RequestInterceptor, ResponseInterceptor {
    private static final Logger logger = LoggerFactory.getLogger(ConditionalRequestInterceptor.class.getName());

    public static final String IF_NONE_MATCH = "If-None-Match";

    private final CacheManager manager;

    public ConditionalRequestInterceptor(CacheManager manager) {
        this.manager = manager;
    }

    @Override
    public void onRequest(ApiRequest request, CancellationToken cancellationToken) {
        if (!"GET".equals(request.getMethod()) || request.getHeader(IF_NONE_MATCH).isPresent()) {
            return;
        }
        manager.getETag(CacheManager.cacheKey(request))
                .ifPresent(etag -> request.setHeader(IF_NONE_MATCH, etag));
    }

    @Override
    public void onResponse(ApiRequest request, ApiResponse response, CancellationToken cancellationToken) {
        if (response.getStatusCode() != 304 || request.getHeader(IF_NONE_MATCH).isEmpty()) {
            return;
        }
        String key = CacheManager.cacheKey(request);
        manager.getForRevalidation(key).ifPresentOrElse(entry -> {
            response.setStatusCode(200);
            response.setBody(entry.data());
            entry.getETag().ifPresent(etag -> {
                if (response.getHeader("ETag").isEmpty()) {
                    response.setHeader("ETag", etag);
                }
            });
            response.setHeader(CacheInterceptor.CACHE_STATUS_HEADER, CacheInterceptor.STATUS_REVALIDATED);
            logger.debug("Revalidated cached response for {}", key);
        }, () -> logger.debug("Got 304 for {} but the cached entry is gone", key));
    }
}
