package com.example.admission.recovery;

/**
 * One step of a recovery plan.
 */
public final class RecoveryAction {

    private final RecoveryStrategy strategy;
    private final String fallbackProvider;
    private final String reason;

    private RecoveryAction(RecoveryStrategy strategy, String fallbackProvider, String reason) {
        this.strategy = strategy;
        this.fallbackProvider = fallbackProvider;
        this.reason = reason;
    }

    public static RecoveryAction fallback(String provider, String reason) {
        return new RecoveryAction(RecoveryStrategy.PROVIDER_FALLBACK, provider, reason);
    }

    public static RecoveryAction degrade(String reason) {
        return new RecoveryAction(RecoveryStrategy.GRACEFUL_DEGRADATION, null, reason);
    }

    public static RecoveryAction manualIntervention(String reason) {
        return new RecoveryAction(RecoveryStrategy.MANUAL_INTERVENTION, null, reason);
    }

    public RecoveryStrategy getStrategy() {
        return strategy;
    }

    /**
     * Only set for {@link RecoveryStrategy#PROVIDER_FALLBACK}.
     */
    public String getFallbackProvider() {
        return fallbackProvider;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return fallbackProvider == null ? strategy.name() : strategy + "(" + fallbackProvider + ")";
    }
}
