package com.example.admission.recovery;

public enum RecoveryStrategy {
    /**
     * Re-run the request against an alternate provider.
     */
    PROVIDER_FALLBACK,

    /**
     * Serve a reduced result (for example cached data) supplied by the caller.
     */
    GRACEFUL_DEGRADATION,

    /**
     * Terminal: nothing automatic is left, surface the error to an operator.
     */
    MANUAL_INTERVENTION
}
