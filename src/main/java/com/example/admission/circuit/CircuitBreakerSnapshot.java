package com.example.admission.circuit;

import java.time.Instant;

/**
 * Point-in-time statistics of one circuit breaker.
 */
public class CircuitBreakerSnapshot {

    private final String name;
    private final CircuitState state;
    private final long totalCalls;
    private final long totalFailures;
    private final long rejectedCalls;
    private final long openedCount;
    private final int callsInWindow;
    private final int failuresInWindow;
    private final Instant lastFailureAt;
    private final Instant stateChangedAt;

    public CircuitBreakerSnapshot(String name, CircuitState state, long totalCalls, long totalFailures,
                                  long rejectedCalls, long openedCount, int callsInWindow, int failuresInWindow,
                                  Instant lastFailureAt, Instant stateChangedAt) {
        this.name = name;
        this.state = state;
        this.totalCalls = totalCalls;
        this.totalFailures = totalFailures;
        this.rejectedCalls = rejectedCalls;
        this.openedCount = openedCount;
        this.callsInWindow = callsInWindow;
        this.failuresInWindow = failuresInWindow;
        this.lastFailureAt = lastFailureAt;
        this.stateChangedAt = stateChangedAt;
    }

    public String getName() {
        return name;
    }

    public CircuitState getState() {
        return state;
    }

    public long getTotalCalls() {
        return totalCalls;
    }

    public long getTotalFailures() {
        return totalFailures;
    }

    public long getRejectedCalls() {
        return rejectedCalls;
    }

    public long getOpenedCount() {
        return openedCount;
    }

    public int getCallsInWindow() {
        return callsInWindow;
    }

    public int getFailuresInWindow() {
        return failuresInWindow;
    }

    public double getFailureRate() {
        return callsInWindow == 0 ? 0.0 : (double) failuresInWindow / callsInWindow;
    }

    public Instant getLastFailureAt() {
        return lastFailureAt;
    }

    public Instant getStateChangedAt() {
        return stateChangedAt;
    }
}
