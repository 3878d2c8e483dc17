package com.example.admission.model;

/**
 * High-level outcome of a single quota admission check.
 */
public enum QuotaDecision {
    /**
     * Request fits inside the environment's own allocation.
     */
    APPROVED,

    /**
     * Request exceeds the environment's allocation but was admitted from spillover capacity.
     */
    APPROVED_SPILLOVER,

    /**
     * Request would push global usage past the total daily limit.
     */
    DENIED_GLOBAL_LIMIT,

    /**
     * Request exceeds the environment's allocation and no spillover capacity is left for it.
     */
    DENIED_ENVIRONMENT_LIMIT,

    /**
     * Concurrent writers kept changing the counters and the conditional increment never won.
     */
    DENIED_CONTENTION,

    /**
     * The shared counter store could not be read or written; requests fail closed.
     */
    DENIED_STORE_FAILURE;

    public boolean isApproved() {
        return this == APPROVED || this == APPROVED_SPILLOVER;
    }
}
