package de.entwicklertraining.capi.interceptor;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.cancellation.CancellationToken;

import java.time.Duration;
import java.time.Instant;

/**
 * Feeds a {@link MetricsCollector}. The request phase stamps the start time into the request
 * metadata; the response phase computes the latency from it.
 */
public class MetricsInterceptor implements RequestInterceptor, ResponseInterceptor {

    private final MetricsCollector collector;

    public MetricsInterceptor(MetricsCollector collector) {
        this.collector = collector;
    }

    @Override
    public void onRequest(ApiRequest request, CancellationToken cancellationToken) {
        request.putMetadata(ApiRequest.METADATA_START_TIME, Instant.now());
    }

    @Override
    public void onResponse(ApiRequest request, ApiResponse response, CancellationToken cancellationToken) {
        Duration latency = request.getMetadata(ApiRequest.METADATA_START_TIME)
                .filter(Instant.class::isInstance)
                .map(start -> Duration.between((Instant) start, Instant.now()))
                .orElse(Duration.ZERO);
        boolean error = response.getError().isPresent() || response.getStatusCode() >= 400;
        collector.record(MetricsCollector.endpointKey(request.getMethod(), request.getPath()), latency, error);
    }

    public MetricsCollector getCollector() {
        return collector;
    }
}
