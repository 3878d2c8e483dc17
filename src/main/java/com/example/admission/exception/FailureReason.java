package com.example.admission.exception;

/**
 * Why a provider call failed. The first three are transient, the rest are not.
 */
public enum FailureReason {
    CONNECTION(true),
    TIMEOUT(true),
    SERVER_ERROR(true),
    AUTHENTICATION(false),
    VALIDATION(false),
    DATA_NOT_FOUND(false);

    private final boolean transientFailure;

    FailureReason(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
