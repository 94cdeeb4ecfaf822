package de.entwicklertraining.capi.interceptor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-endpoint request statistics. Updates and the observer list share one lock; observers are
 * invoked after the update, outside the lock, with an immutable snapshot.
 */
public class MetricsCollector {
    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class.getName());

    private final Object lock = new Object();
    private final Map<String, EndpointMetrics> metrics = new HashMap<>();
    private final List<MetricsObserver> observers = new ArrayList<>();

    public static String endpointKey(String method, String path) {
        return method + " " + path;
    }

    public void addObserver(MetricsObserver observer) {
        synchronized (lock) {
            observers.add(observer);
        }
    }

    public void removeObserver(MetricsObserver observer) {
        synchronized (lock) {
            observers.remove(observer);
        }
    }

    /**
     * Adds one completed request to the endpoint's aggregate.
     */
    public void record(String endpoint, Duration latency, boolean error) {
        EndpointMetrics snapshot;
        List<MetricsObserver> toNotify;
        synchronized (lock) {
            snapshot = metrics.getOrDefault(endpoint, EndpointMetrics.empty()).add(latency, error, Instant.now());
            metrics.put(endpoint, snapshot);
            toNotify = List.copyOf(observers);
        }
        for (MetricsObserver observer : toNotify) {
            try {
                observer.onMetricsChanged(endpoint, snapshot);
            } catch (RuntimeException e) {
                logger.warn("Metrics observer failed for {}: {}", endpoint, e.getMessage(), e);
            }
        }
    }

    public Optional<EndpointMetrics> getMetrics(String endpoint) {
        synchronized (lock) {
            return Optional.ofNullable(metrics.get(endpoint));
        }
    }

    public Map<String, EndpointMetrics> getAllMetrics() {
        synchronized (lock) {
            return Map.copyOf(metrics);
        }
    }

    public void reset() {
        synchronized (lock) {
            metrics.clear();
        }
    }
}
