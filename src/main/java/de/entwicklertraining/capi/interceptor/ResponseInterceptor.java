package de.entwicklertraining.capi.interceptor;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.cancellation.CancellationToken;

/**
 * Runs after the transport call (or after a short-circuit), also for transport failures,
 * which arrive as a response with {@link ApiResponse#getError()} set.
 */
@FunctionalInterface
public interface ResponseInterceptor {

    void onResponse(ApiRequest request, ApiResponse response, CancellationToken cancellationToken);
}
