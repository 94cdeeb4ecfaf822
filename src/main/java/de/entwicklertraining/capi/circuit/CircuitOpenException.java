package de.entwicklertraining.capi.circuit;

import de.entwicklertraining.capi.ApiClientException;
import de.entwicklertraining.capi.ErrorKind;

/**
 * Thrown when a request is rejected because the circuit breaker is open.
 */
public class CircuitOpenException extends ApiClientException {

    public CircuitOpenException() {
        super(ErrorKind.CIRCUIT_OPEN);
    }
}
