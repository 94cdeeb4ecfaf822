package de.entwicklertraining.capi.interceptor;

import java.time.Duration;
import java.time.Instant;

/**
 * Aggregated numbers for one {@code "METHOD PATH"} endpoint.
 *
 * @param totalRequests   requests seen
 * @param totalErrors     requests that failed in transport or returned a status of 400 and above
 * @param totalLatency    summed latency
 * @param averageLatency  {@code totalLatency / totalRequests}
 * @param lastRequestTime completion time of the latest request
 */
public record EndpointMetrics(long totalRequests, long totalErrors, Duration totalLatency,
                              Duration averageLatency, Instant lastRequestTime) {

    static EndpointMetrics empty() {
        return new EndpointMetrics(0, 0, Duration.ZERO, Duration.ZERO, null);
    }

    EndpointMetrics add(Duration latency, boolean error, Instant completedAt) {
        long requests = totalRequests + 1;
        Duration total = totalLatency.plus(latency);
        return new EndpointMetrics(requests, totalErrors + (error ? 1 : 0), total, total.dividedBy(requests), completedAt);
    }

    public double errorRate() {
        return totalRequests == 0 ? 0.0 : (double) totalErrors / totalRequests;
    }
}
