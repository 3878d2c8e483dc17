package com.example.admission.quota;

import java.util.Map;

/**
 * Shared daily counters behind the quota manager.
 * <p>
 * Implementations must make {@link #compareAndIncrement} atomic with respect to every other
 * writer of the same keys. Counter keys expire on their own; nothing deletes them except
 * {@link #reset}.
 */
public interface QuotaCounterStore {

    /**
     * Reads the global counter and the counter of every environment in {@code keys}. Missing keys read as zero.
     */
    QuotaUsageSnapshot read(QuotaKeys keys);

    /**
     * Adds {@code amount} to {@code environment}'s counter and the global counter, only if every
     * counter still holds the value in {@code expected}.
     *
     * @return true if the increment was applied
     */
    boolean compareAndIncrement(QuotaKeys keys, QuotaUsageSnapshot expected, String environment, long amount);

    /**
     * Clears today's usage. A {@code null} environment clears every usage counter of the day,
     * including environments outside {@code keys}; otherwise only that environment's counter is
     * cleared and its usage is taken off the global counter. Allocation overrides are kept.
     */
    void reset(QuotaKeys keys, String environment);

    /**
     * Per-day allocation overrides, keyed by environment.
     */
    Map<String, Long> readAllocationOverrides(QuotaKeys keys);

    void writeAllocationOverride(QuotaKeys keys, String environment, long allocated);

    /**
     * @return true when the atomicity guarantee spans processes and hosts
     */
    boolean isDistributed();
}
