package com.example.admission.quota;

import com.example.admission.model.QuotaAllocation;
import com.example.admission.model.QuotaDecision;

/**
 * Admission rule applied to one consistent view of the counters.
 * <ol>
 *   <li>global used + amount above the total daily limit: denied, whatever the allocation</li>
 *   <li>environment used + amount within its allocation: approved</li>
 *   <li>otherwise spillover: approved only if, after the increment, the unused allocation of every
 *       strictly higher-priority environment still fits under the total daily limit</li>
 * </ol>
 * Peers and lower-priority environments may be borrowed from; between them the first atomic writer wins.
 */
public final class QuotaPolicy {

    private QuotaPolicy() {
    }

    public static QuotaDecision evaluate(QuotaAllocation allocation, QuotaUsageSnapshot usage, String environment, long amount) {
        long total = allocation.getTotalDailyLimit();
        long globalUsed = usage.getGlobalUsed();
        if (globalUsed + amount > total) {
            return QuotaDecision.DENIED_GLOBAL_LIMIT;
        }
        if (usage.usedBy(environment) + amount <= allocation.allocatedTo(environment)) {
            return QuotaDecision.APPROVED;
        }
        long reserved = reservedForHigherPriority(allocation, usage, environment);
        if (globalUsed + amount + reserved <= total) {
            return QuotaDecision.APPROVED_SPILLOVER;
        }
        return QuotaDecision.DENIED_ENVIRONMENT_LIMIT;
    }

    /**
     * Sum of the allocation still unused by environments that outrank {@code environment}.
     */
    static long reservedForHigherPriority(QuotaAllocation allocation, QuotaUsageSnapshot usage, String environment) {
        int priority = allocation.priorityOf(environment);
        long reserved = 0;
        for (String other : allocation.environmentNames()) {
            if (other.equals(environment) || allocation.priorityOf(other) >= priority) {
                continue;
            }
            reserved += Math.max(0L, allocation.allocatedTo(other) - usage.usedBy(other));
        }
        return reserved;
    }
}
