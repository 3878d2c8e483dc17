package com.example.admission.circuit;

import com.example.admission.exception.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.concurrent.Callable;

/**
 * Per-resource circuit breaker with a count-based sliding window of call outcomes.
 * <ul>
 *   <li>CLOSED to OPEN: failures in the window reach {@code failureThreshold}</li>
 *   <li>OPEN to HALF_OPEN: {@code recoveryTimeout} elapsed since opening</li>
 *   <li>HALF_OPEN to CLOSED: {@code successThreshold} consecutive trial successes</li>
 *   <li>HALF_OPEN to OPEN: any recorded trial failure</li>
 * </ul>
 * In HALF_OPEN a single trial runs at a time; concurrent callers are rejected until it completes.
 * The lock is never held while the protected operation runs.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    // true = failure, oldest first
    private final ArrayDeque<Boolean> window = new ArrayDeque<>();
    private int failuresInWindow;

    private CircuitState state = CircuitState.CLOSED;
    private Instant stateChangedAt;
    private int consecutiveSuccesses;
    private boolean trialInFlight;
    // bumped on every transition and reset
    private long generation;

    private long totalCalls;
    private long totalFailures;
    private long rejectedCalls;
    private long openedCount;
    private Instant lastFailureAt;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.stateChangedAt = clock.instant();
    }

    /**
     * Runs {@code operation} unless the circuit is open.
     *
     * @throws CircuitOpenException if the circuit rejects the call; the operation is not invoked
     * @throws Exception           whatever the operation throws
     */
    public <T> T call(Callable<T> operation) throws Exception {
        return call(acquirePermission(), operation);
    }

    /**
     * Runs {@code operation} under a permission obtained earlier from {@link #acquirePermission()}.
     * The outcome only moves the state if no transition happened since the permission was granted.
     */
    public <T> T call(Permission permission, Callable<T> operation) throws Exception {
        T result;
        try {
            result = operation.call();
        } catch (Exception ex) {
            if (config.isRecordedFailure(ex)) {
                onFailure(permission, ex);
            } else {
                onIgnored(permission);
            }
            throw ex;
        } catch (Error err) {
            onIgnored(permission);
            throw err;
        }
        onSuccess(permission);
        return result;
    }

    /**
     * Wraps {@code operation} so every invocation goes through this breaker.
     */
    public <T> Callable<T> decorate(Callable<T> operation) {
        return () -> call(operation);
    }

    /**
     * Fails fast if a call made now would be rejected, without changing any state.
     */
    public synchronized void checkPermitted() {
        if (state == CircuitState.OPEN) {
            Duration remaining = remainingOpen();
            if (!remaining.isZero()) {
                throw new CircuitOpenException(name, remaining);
            }
        } else if (state == CircuitState.HALF_OPEN && trialInFlight) {
            throw new CircuitOpenException(name, Duration.ZERO);
        }
    }

    /**
     * Admits one call, moving an expired OPEN circuit to HALF_OPEN. In HALF_OPEN the permission
     * is the single trial. Pass it to {@link #call(Permission, Callable)}, or to
     * {@link #release(Permission)} if the call is abandoned.
     *
     * @throws CircuitOpenException if the circuit rejects the call
     */
    public synchronized Permission acquirePermission() {
        if (state == CircuitState.OPEN) {
            Duration remaining = remainingOpen();
            if (!remaining.isZero()) {
                rejectedCalls++;
                log.debug("Circuit breaker '{}' is OPEN, blocking call ({} ms to trial)", name, remaining.toMillis());
                throw new CircuitOpenException(name, remaining);
            }
            transitionTo(CircuitState.HALF_OPEN);
        }
        boolean trial = state == CircuitState.HALF_OPEN;
        if (trial) {
            if (trialInFlight) {
                rejectedCalls++;
                throw new CircuitOpenException(name, Duration.ZERO);
            }
            trialInFlight = true;
        }
        return new Permission(generation, trial);
    }

    /**
     * Gives back a permission whose call was never made. Nothing is recorded.
     */
    public synchronized void release(Permission permission) {
        if (permission.trial && permission.generation == generation) {
            trialInFlight = false;
        }
    }

    private Duration remainingOpen() {
        Duration elapsed = Duration.between(stateChangedAt, clock.instant());
        Duration remaining = config.getRecoveryTimeout().minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private synchronized void onSuccess(Permission permission) {
        totalCalls++;
        if (isStale(permission)) {
            return;
        }
        record(false);
        if (permission.trial) {
            trialInFlight = false;
            consecutiveSuccesses++;
            if (consecutiveSuccesses >= config.getSuccessThreshold()) {
                transitionTo(CircuitState.CLOSED);
            }
        }
    }

    private synchronized void onFailure(Permission permission, Exception failure) {
        totalCalls++;
        totalFailures++;
        lastFailureAt = clock.instant();
        if (isStale(permission)) {
            return;
        }
        record(true);
        if (permission.trial) {
            trialInFlight = false;
            log.warn("Circuit breaker '{}' trial failed: {}", name, failure.toString());
            transitionTo(CircuitState.OPEN);
        } else if (failuresInWindow >= config.getFailureThreshold()) {
            transitionTo(CircuitState.OPEN);
        } else {
            log.debug("Circuit breaker '{}' recorded failure {}/{}", name, failuresInWindow, config.getFailureThreshold());
        }
    }

    private synchronized void onIgnored(Permission permission) {
        totalCalls++;
        release(permission);
    }

    // admitted before the last transition
    private boolean isStale(Permission permission) {
        if (permission.generation != generation) {
            log.debug("Circuit breaker '{}' ignoring outcome of a call admitted before the last transition", name);
            return true;
        }
        return false;
    }

    private void record(boolean failure) {
        if (window.size() == config.getSlidingWindowSize()) {
            if (window.removeFirst()) {
                failuresInWindow--;
            }
        }
        window.addLast(failure);
        if (failure) {
            failuresInWindow++;
        }
    }

    private void transitionTo(CircuitState newState) {
        CircuitState oldState = state;
        state = newState;
        generation++;
        stateChangedAt = clock.instant();
        consecutiveSuccesses = 0;
        trialInFlight = false;
        switch (newState) {
            case OPEN:
                openedCount++;
                log.warn("Circuit breaker '{}' opened ({} failures in window of {})",
                        name, failuresInWindow, window.size());
                break;
            case CLOSED:
                window.clear();
                failuresInWindow = 0;
                log.info("Circuit breaker '{}' closed - resource recovered", name);
                break;
            case HALF_OPEN:
                log.info("Circuit breaker '{}' half-open - testing recovery", name);
                break;
            default:
                break;
        }
        log.debug("Circuit breaker '{}' transition {} -> {}", name, oldState, newState);
    }

    /**
     * Effective state; an OPEN circuit whose recovery timeout has elapsed reports HALF_OPEN. The
     * transition itself happens when the next call is admitted.
     */
    public synchronized CircuitState getState() {
        if (state == CircuitState.OPEN && remainingOpen().isZero()) {
            return CircuitState.HALF_OPEN;
        }
        return state;
    }

    public synchronized void reset() {
        state = CircuitState.CLOSED;
        generation++;
        stateChangedAt = clock.instant();
        consecutiveSuccesses = 0;
        trialInFlight = false;
        window.clear();
        failuresInWindow = 0;
        log.info("Circuit breaker '{}' manually reset", name);
    }

    public synchronized void forceOpen() {
        transitionTo(CircuitState.OPEN);
        log.warn("Circuit breaker '{}' manually opened", name);
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(name, getState(), totalCalls, totalFailures, rejectedCalls, openedCount,
                window.size(), failuresInWindow, lastFailureAt, stateChangedAt);
    }

    /**
     * Admission granted by {@link #acquirePermission()}, tied to the state it was granted in.
     */
    public static final class Permission {

        private final long generation;
        private final boolean trial;

        private Permission(long generation, boolean trial) {
            this.generation = generation;
            this.trial = trial;
        }

        public boolean isTrial() {
            return trial;
        }
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }
}
