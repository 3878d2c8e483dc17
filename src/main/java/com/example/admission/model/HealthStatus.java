package com.example.admission.model;

/**
 * Overall resilience health derived from the share of closed circuit breakers.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public static HealthStatus fromScore(double score) {
        if (score >= 90.0) {
            return HEALTHY;
        }
        if (score >= 70.0) {
            return DEGRADED;
        }
        return UNHEALTHY;
    }
}
