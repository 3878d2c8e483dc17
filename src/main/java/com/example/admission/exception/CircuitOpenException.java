package com.example.admission.exception;

import java.time.Duration;

/**
 * Raised instead of invoking a protected operation while its circuit is open.
 */
public class CircuitOpenException extends AdmissionException {

    private final String resource;
    private final Duration remaining;

    public CircuitOpenException(String resource, Duration remaining) {
        super("CIRCUIT_OPEN", "Circuit breaker '" + resource + "' is open, next trial in " + remaining.toMillis() + " ms");
        this.resource = resource;
        this.remaining = remaining;
        addContext("resource", resource);
        addContext("remainingMs", remaining.toMillis());
    }

    public String getResource() {
        return resource;
    }

    /**
     * @return time until the breaker admits a half-open trial; zero when a trial is already in flight
     */
    public Duration getRemaining() {
        return remaining;
    }
}
