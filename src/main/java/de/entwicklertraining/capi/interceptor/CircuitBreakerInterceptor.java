package de.entwicklertraining.capi.interceptor;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import de.entwicklertraining.capi.circuit.CircuitBreaker;

/**
 * Consults the breaker before a request and reports the outcome afterwards.
 * Responses served from cache are not reported.
 */
public class CircuitBreakerInterceptor implements RequestInterceptor, ResponseInterceptor {

    private final CircuitBreaker breaker;

    public CircuitBreakerInterceptor(CircuitBreaker breaker) {
        this.breaker = breaker;
    }

    @Override
    public void onRequest(ApiRequest request, CancellationToken cancellationToken) {
        breaker.checkRequest();
    }

    @Override
    public void onResponse(ApiRequest request, ApiResponse response, CancellationToken cancellationToken) {
        if (response.isFromCache()) {
            return;
        }
        breaker.recordResult(response.getStatusCode(), response.getError().orElse(null));
    }

    public CircuitBreaker getBreaker() {
        return breaker;
    }
}
