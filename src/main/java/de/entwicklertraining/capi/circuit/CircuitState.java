package de.entwicklertraining.capi.circuit;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
