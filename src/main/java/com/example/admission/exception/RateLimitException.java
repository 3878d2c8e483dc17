package com.example.admission.exception;

import java.time.Duration;

/**
 * Raised when a provider rate limit will not admit a request soon enough.
 */
public class RateLimitException extends AdmissionException {

    private final String provider;
    private final Duration retryAfter;

    public RateLimitException(String provider, Duration retryAfter) {
        super("RATE_LIMITED", "Rate limit reached for provider " + provider + ", retry after " + retryAfter.toMillis() + " ms");
        this.provider = provider;
        this.retryAfter = retryAfter;
        addContext("provider", provider);
        addContext("retryAfterMs", retryAfter.toMillis());
    }

    public String getProvider() {
        return provider;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
