package de.entwicklertraining.capi.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Failure-rate state machine guarding outbound calls.
 * <p>
 * <ul>
 *   <li>CLOSED: calls pass; {@code failureThreshold} failures in a row open the circuit.</li>
 *   <li>OPEN: calls are rejected until {@code timeout} has passed since the last failure,
 *       then the next call moves the breaker to HALF_OPEN.</li>
 *   <li>HALF_OPEN: probes pass; any failure re-opens, {@code successThreshold} successes close.</li>
 * </ul>
 * A failure is a transport error or a status of 500 and above. All state is guarded by this
 * instance's monitor.
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class.getName());

    private final CircuitBreakerConfig config;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failures;
    private int successes;
    private Instant lastFailure;

    public CircuitBreaker() {
        this(CircuitBreakerConfig.defaults());
    }

    public CircuitBreaker(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC());
    }

    public CircuitBreaker(CircuitBreakerConfig config, Clock clock) {
        this.config = config == null ? CircuitBreakerConfig.defaults() : config;
        this.clock = clock;
    }

    /**
     * Admits or rejects a call.
     *
     * @throws CircuitOpenException if the circuit is open and the open period has not elapsed
     */
    public synchronized void checkRequest() {
        if (state != CircuitState.OPEN) {
            return;
        }
        Duration sinceLastFailure = Duration.between(lastFailure, clock.instant());
        if (sinceLastFailure.compareTo(config.getTimeout()) > 0) {
            transitionTo(CircuitState.HALF_OPEN);
            successes = 0;
            return;
        }
        throw new CircuitOpenException();
    }

    /**
     * Records the outcome of a call.
     *
     * @param statusCode HTTP status, ignored if {@code error} is set
     * @param error      transport failure, or {@code null}
     */
    public void recordResult(int statusCode, Throwable error) {
        if (error != null || statusCode >= 500) {
            recordFailure();
        } else {
            recordSuccess();
        }
    }

    public synchronized void recordFailure() {
        failures++;
        lastFailure = clock.instant();
        if (state == CircuitState.HALF_OPEN || failures >= config.getFailureThreshold()) {
            transitionTo(CircuitState.OPEN);
        }
    }

    public synchronized void recordSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            successes++;
            if (successes >= config.getSuccessThreshold()) {
                transitionTo(CircuitState.CLOSED);
                failures = 0;
            }
        } else if (state == CircuitState.CLOSED) {
            failures = 0;
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailures() {
        return failures;
    }

    /**
     * Forces the breaker back to CLOSED with cleared counters.
     */
    public synchronized void reset() {
        transitionTo(CircuitState.CLOSED);
        failures = 0;
        successes = 0;
        lastFailure = null;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private void transitionTo(CircuitState next) {
        if (state != next) {
            logger.info("Circuit breaker state change: {} -> {} (failures={})", state, next, failures);
            state = next;
        }
    }
}
