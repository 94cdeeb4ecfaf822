package de.entwicklertraining.capi.interceptor;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.cancellation.CancellationToken;

import java.util.Map;

/**
 * Sets a fixed set of headers on every request.
 */
public class HeaderInterceptor implements RequestInterceptor {

    private final Map<String, String> headers;

    public HeaderInterceptor(Map<String, String> headers) {
        this.headers = Map.copyOf(headers);
    }

    @Override
    public void onRequest(ApiRequest request, CancellationToken cancellationToken) {
        headers.forEach(request::setHeader);
    }
}
