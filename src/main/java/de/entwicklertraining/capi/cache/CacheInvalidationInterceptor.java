package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import de.entwicklertraining.capi.interceptor.ResponseInterceptor;

/**
 * After a successful POST, PUT, PATCH or DELETE, removes the cached GET responses the
 * mutation made stale (see {@link CacheManager#invalidateRelated(String)}).
 */
public class CacheInvalidationInterceptor implements ResponseInterceptor {

    private final CacheManager manager;

    public CacheInvalidationInterceptor(CacheManager manager) {
        this.manager = manager;
    }

    @Override
    public void onResponse(ApiRequest request, ApiResponse response, CancellationToken cancellationToken) {
        if (request.isMutating() && response.isSuccess()) {
            manager.invalidateRelated(request.getPath());
        }
    }
}
