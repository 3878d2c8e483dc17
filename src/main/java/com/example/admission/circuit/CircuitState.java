package com.example.admission.circuit;

public enum CircuitState {
    /**
     * Normal operation; failures are tracked in the sliding window.
     */
    CLOSED,

    /**
     * Calls fail fast until the recovery timeout elapses.
     */
    OPEN,

    /**
     * One trial call at a time tests whether the resource recovered.
     */
    HALF_OPEN
}
