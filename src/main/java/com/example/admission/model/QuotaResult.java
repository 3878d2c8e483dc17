package com.example.admission.model;

/**
 * Result returned by the quota manager for a single admission check.
 * Usage figures are the counter values after the increment when approved, or as observed when denied.
 */
public class QuotaResult {

    private final QuotaDecision decision;
    private final String environment;
    private final long amount;
    private final long environmentUsed;
    private final long allocated;
    private final long globalUsed;
    private final long globalLimit;

    public QuotaResult(QuotaDecision decision, String environment, long amount,
                       long environmentUsed, long allocated, long globalUsed, long globalLimit) {
        this.decision = decision;
        this.environment = environment;
        this.amount = amount;
        this.environmentUsed = environmentUsed;
        this.allocated = allocated;
        this.globalUsed = globalUsed;
        this.globalLimit = globalLimit;
    }

    public static QuotaResult storeFailure(String environment, long amount, long allocated, long globalLimit) {
        return new QuotaResult(QuotaDecision.DENIED_STORE_FAILURE, environment, amount, -1, allocated, -1, globalLimit);
    }

    public boolean isApproved() {
        return decision.isApproved();
    }

    /**
     * @return true when the request went beyond the environment's allocation and spillover had to be evaluated
     */
    public boolean isSpilloverConsidered() {
        return decision == QuotaDecision.APPROVED_SPILLOVER || decision == QuotaDecision.DENIED_ENVIRONMENT_LIMIT;
    }

    public QuotaDecision getDecision() {
        return decision;
    }

    public String getEnvironment() {
        return environment;
    }

    public long getAmount() {
        return amount;
    }

    public long getEnvironmentUsed() {
        return environmentUsed;
    }

    public long getAllocated() {
        return allocated;
    }

    public long getGlobalUsed() {
        return globalUsed;
    }

    public long getGlobalLimit() {
        return globalLimit;
    }

    @Override
    public String toString() {
        return "QuotaResult{" + decision + ", environment=" + environment + ", amount=" + amount +
                ", environmentUsed=" + environmentUsed + "/" + allocated +
                ", globalUsed=" + globalUsed + "/" + globalLimit + '}';
    }
}
