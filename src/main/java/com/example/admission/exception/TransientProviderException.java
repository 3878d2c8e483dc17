package com.example.admission.exception;

/**
 * Retryable provider failure: connection reset, timeout, 5xx-style response.
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String provider, FailureReason reason, String message) {
        this(provider, reason, message, null);
    }

    public TransientProviderException(String provider, FailureReason reason, String message, Throwable cause) {
        super("PROVIDER_TRANSIENT", provider, requireTransient(reason), message, cause);
    }

    private static FailureReason requireTransient(FailureReason reason) {
        if (!reason.isTransient()) {
            throw new IllegalArgumentException(reason + " is not a transient failure reason");
        }
        return reason;
    }
}
