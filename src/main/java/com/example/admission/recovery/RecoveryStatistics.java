package com.example.admission.recovery;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregated recovery outcomes for one operation name. Mutated only under the manager's lock;
 * callers receive copies.
 */
public class RecoveryStatistics {

    private long totalAttempts;
    private long successfulRecoveries;
    private long failedRecoveries;
    private Duration totalRecoveryTime = Duration.ZERO;
    private Instant lastRecovery;
    private final Map<RecoveryStrategy, Long> strategyAttempts = new EnumMap<>(RecoveryStrategy.class);
    private final Map<RecoveryStrategy, Long> strategySuccesses = new EnumMap<>(RecoveryStrategy.class);

    void record(RecoveryResult<?> result, Instant at) {
        totalAttempts++;
        totalRecoveryTime = totalRecoveryTime.plus(result.getElapsed());
        lastRecovery = at;
        if (result.isSuccess()) {
            successfulRecoveries++;
            strategySuccesses.merge(result.getStrategyUsed(), 1L, Long::sum);
        } else {
            failedRecoveries++;
        }
        strategyAttempts.merge(result.getStrategyUsed(), 1L, Long::sum);
    }

    RecoveryStatistics copy() {
        RecoveryStatistics copy = new RecoveryStatistics();
        copy.totalAttempts = totalAttempts;
        copy.successfulRecoveries = successfulRecoveries;
        copy.failedRecoveries = failedRecoveries;
        copy.totalRecoveryTime = totalRecoveryTime;
        copy.lastRecovery = lastRecovery;
        copy.strategyAttempts.putAll(strategyAttempts);
        copy.strategySuccesses.putAll(strategySuccesses);
        return copy;
    }

    public long getTotalAttempts() {
        return totalAttempts;
    }

    public long getSuccessfulRecoveries() {
        return successfulRecoveries;
    }

    public long getFailedRecoveries() {
        return failedRecoveries;
    }

    public Duration getTotalRecoveryTime() {
        return totalRecoveryTime;
    }

    public Instant getLastRecovery() {
        return lastRecovery;
    }

    public Map<RecoveryStrategy, Long> getStrategyAttempts() {
        return Collections.unmodifiableMap(strategyAttempts);
    }

    public Map<RecoveryStrategy, Long> getStrategySuccesses() {
        return Collections.unmodifiableMap(strategySuccesses);
    }
}
