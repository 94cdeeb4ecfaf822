package de.entwicklertraining.capi.interceptor;

/**
 * Called on the request thread after the metrics of an endpoint changed.
 */
@FunctionalInterface
public interface MetricsObserver {

    void onMetricsChanged(String endpoint, EndpointMetrics metrics);
}
