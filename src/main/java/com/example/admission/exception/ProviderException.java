package com.example.admission.exception;

/**
 * Failure reported by a market data provider call.
 */
public abstract class ProviderException extends AdmissionException {

    private final String provider;
    private final FailureReason reason;

    protected ProviderException(String errorCode, String provider, FailureReason reason, String message, Throwable cause) {
        super(errorCode, "Provider " + provider + ": " + message, cause);
        this.provider = provider;
        this.reason = reason;
        addContext("provider", provider);
        addContext("reason", reason);
    }

    public String getProvider() {
        return provider;
    }

    public FailureReason getReason() {
        return reason;
    }
}
