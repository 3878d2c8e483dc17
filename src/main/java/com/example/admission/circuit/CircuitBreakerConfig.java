package com.example.admission.circuit;

import com.example.admission.exception.FailureReason;
import com.example.admission.exception.FatalProviderException;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Immutable thresholds of one circuit breaker.
 */
public final class CircuitBreakerConfig {

    /**
     * Invalid requests and missing data say nothing about the provider's health.
     */
    public static final Predicate<Throwable> DEFAULT_RECORD_FAILURE = failure -> {
        if (failure instanceof FatalProviderException fatal) {
            return fatal.getReason() != FailureReason.VALIDATION && fatal.getReason() != FailureReason.DATA_NOT_FOUND;
        }
        return true;
    };

    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int successThreshold;
    private final int slidingWindowSize;
    private final Predicate<Throwable> recordFailure;

    public CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout, int successThreshold, int slidingWindowSize) {
        this(failureThreshold, recoveryTimeout, successThreshold, slidingWindowSize, DEFAULT_RECORD_FAILURE);
    }

    public CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout, int successThreshold,
                                int slidingWindowSize, Predicate<Throwable> recordFailure) {
        if (failureThreshold <= 0) throw new IllegalArgumentException("failureThreshold <= 0");
        if (successThreshold <= 0) throw new IllegalArgumentException("successThreshold <= 0");
        if (slidingWindowSize < failureThreshold) {
            throw new IllegalArgumentException("slidingWindowSize must be >= failureThreshold");
        }
        if (recoveryTimeout.isNegative()) throw new IllegalArgumentException("recoveryTimeout < 0");
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.successThreshold = successThreshold;
        this.slidingWindowSize = slidingWindowSize;
        this.recordFailure = recordFailure;
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(5, Duration.ofSeconds(60), 3, 100);
    }

    public CircuitBreakerConfig withRecordFailure(Predicate<Throwable> predicate) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold, slidingWindowSize, predicate);
    }

    public boolean isRecordedFailure(Throwable failure) {
        return recordFailure.test(failure);
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    public int getSuccessThreshold() {
        return successThreshold;
    }

    public int getSlidingWindowSize() {
        return slidingWindowSize;
    }
}
