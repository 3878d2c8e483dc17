package com.example.admission.exception;

/**
 * Non-retryable provider failure: rejected credentials, invalid request, missing data.
 */
public class FatalProviderException extends ProviderException {

    public FatalProviderException(String provider, FailureReason reason, String message) {
        this(provider, reason, message, null);
    }

    public FatalProviderException(String provider, FailureReason reason, String message, Throwable cause) {
        super("PROVIDER_FATAL", provider, requireFatal(reason), message, cause);
    }

    private static FailureReason requireFatal(FailureReason reason) {
        if (reason.isTransient()) {
            throw new IllegalArgumentException(reason + " is not a fatal failure reason");
        }
        return reason;
    }
}
