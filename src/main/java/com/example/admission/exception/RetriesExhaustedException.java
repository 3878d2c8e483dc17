package com.example.admission.exception;

/**
 * Marks a retryable failure that persisted through every attempt the policy allowed.
 * The last failure is the cause.
 */
public class RetriesExhaustedException extends AdmissionException {

    private final String operation;
    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super("RETRIES_EXHAUSTED", operation + " failed after " + attempts + " attempt(s): " + lastFailure, lastFailure);
        this.operation = operation;
        this.attempts = attempts;
        addContext("operation", operation);
        addContext("attempts", attempts);
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
