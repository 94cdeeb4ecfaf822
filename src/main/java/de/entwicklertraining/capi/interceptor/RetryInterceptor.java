package de.entwicklertraining.capi.interceptor;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.RetryConfig;
import de.entwicklertraining.capi.cancellation.CancellationToken;

/**
 * Flags responses whose status is retryable. The retry loop itself lives in
 * {@link de.entwicklertraining.capi.ApiClient#executeWithRetry}.
 * <p>
 * Responses served from the cache are never flagged, another attempt would read the same entry.
 */
public class RetryInterceptor implements ResponseInterceptor {

    private final RetryConfig config;

    public RetryInterceptor() {
        this(RetryConfig.defaults());
    }

    public RetryInterceptor(RetryConfig config) {
        this.config = config;
    }

    @Override
    public void onResponse(ApiRequest request, ApiResponse response, CancellationToken cancellationToken) {
        if (response.isFromCache()) {
            return;
        }
        if (response.getError().isEmpty() && config.isRetryable(response.getStatusCode())) {
            response.markRetryEligible();
        }
    }

    public RetryConfig getConfig() {
        return config;
    }
}
