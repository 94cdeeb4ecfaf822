package de.entwicklertraining.capi.interceptor;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.cancellation.CancellationToken;

/**
 * Runs before the transport call. Throwing aborts the cycle.
 */
@FunctionalInterface
public interface RequestInterceptor {

    void onRequest(ApiRequest request, CancellationToken cancellationToken);
}
