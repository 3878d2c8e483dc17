package com.example.admission.model;

import java.util.Objects;

/**
 * Today's consumption of the whole shared subscription.
 */
public final class GlobalQuotaStatus {

    private final long totalDailyLimit;
    private final long globalUsed;

    public GlobalQuotaStatus(long totalDailyLimit, long globalUsed) {
        this.totalDailyLimit = totalDailyLimit;
        this.globalUsed = globalUsed;
    }

    public long getTotalDailyLimit() {
        return totalDailyLimit;
    }

    public long getGlobalUsed() {
        return globalUsed;
    }

    public long getGlobalAvailable() {
        return Math.max(0L, totalDailyLimit - globalUsed);
    }

    public boolean isExhausted() {
        return globalUsed >= totalDailyLimit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GlobalQuotaStatus that)) return false;
        return totalDailyLimit == that.totalDailyLimit && globalUsed == that.globalUsed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalDailyLimit, globalUsed);
    }

    @Override
    public String toString() {
        return "global: " + globalUsed + "/" + totalDailyLimit;
    }
}
