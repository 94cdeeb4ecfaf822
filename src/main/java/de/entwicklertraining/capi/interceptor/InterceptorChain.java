package de.entwicklertraining.capi.interceptor;

import de.entwicklertraining.capi.ApiClientException;
import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.cancellation.CancellationException;
import de.entwicklertraining.capi.cancellation.CancellationToken;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered request and response middleware.
 * <p>
 * Interceptors of each phase run in registration order and the first exception stops the phase.
 * Pipeline exceptions ({@link ApiClientException}, {@link CancellationException}) are rethrown as
 * they are; anything else is wrapped in an {@link InterceptorException}.
 */
public class InterceptorChain {

    private final List<RequestInterceptor> requestInterceptors = new CopyOnWriteArrayList<>();
    private final List<ResponseInterceptor> responseInterceptors = new CopyOnWriteArrayList<>();

    public InterceptorChain addRequestInterceptor(RequestInterceptor interceptor) {
        requestInterceptors.add(interceptor);
        return this;
    }

    public InterceptorChain addResponseInterceptor(ResponseInterceptor interceptor) {
        responseInterceptors.add(interceptor);
        return this;
    }

    public List<RequestInterceptor> getRequestInterceptors() {
        return List.copyOf(requestInterceptors);
    }

    public List<ResponseInterceptor> getResponseInterceptors() {
        return List.copyOf(responseInterceptors);
    }

    public void executeRequestInterceptors(ApiRequest request, CancellationToken cancellationToken) {
        for (RequestInterceptor interceptor : requestInterceptors) {
            try {
                interceptor.onRequest(request, cancellationToken);
            } catch (ApiClientException | CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new InterceptorException("request interceptor failed: " + e.getMessage(), e);
            }
        }
    }

    public void executeResponseInterceptors(ApiRequest request, ApiResponse response,
                                            CancellationToken cancellationToken) {
        for (ResponseInterceptor interceptor : responseInterceptors) {
            try {
                interceptor.onResponse(request, response, cancellationToken);
            } catch (ApiClientException | CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new InterceptorException("response interceptor failed: " + e.getMessage(), e);
            }
        }
    }
}
