package com.example.admission.exception;

import com.example.admission.recovery.RecoveryStrategy;

import java.util.List;

/**
 * Surfaced to the caller when a provider request failed and no recovery strategy succeeded.
 * The most recent failure is the cause.
 */
public class RecoveryFailedException extends AdmissionException {

    private final List<RecoveryStrategy> attemptedStrategies;

    public RecoveryFailedException(String operation, String environment, String provider,
                                   List<RecoveryStrategy> attemptedStrategies, Throwable finalError) {
        super("RECOVERY_FAILED", operation + " for provider " + provider + " failed and could not be recovered", finalError);
        this.attemptedStrategies = List.copyOf(attemptedStrategies);
        addContext("operation", operation);
        addContext("environment", environment);
        addContext("provider", provider);
        addContext("attemptedStrategies", this.attemptedStrategies);
    }

    public List<RecoveryStrategy> getAttemptedStrategies() {
        return attemptedStrategies;
    }
}
