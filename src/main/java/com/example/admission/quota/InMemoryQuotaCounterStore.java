package com.example.admission.quota;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Process-local counter store for single-process deployments and tests.
 * <p>
 * Atomic only within this JVM: environments running in other processes keep their own
 * counters, so the global ceiling is not enforced across them.
 */
public class InMemoryQuotaCounterStore implements QuotaCounterStore {

    private final Clock clock;
    private final Duration keyTtl;
    private final Map<String, Entry> entries = new HashMap<>();

    public InMemoryQuotaCounterStore(Clock clock, Duration keyTtl) {
        this.clock = clock;
        this.keyTtl = keyTtl;
    }

    @Override
    public synchronized QuotaUsageSnapshot read(QuotaKeys keys) {
        purgeExpired();
        Map<String, Long> used = new LinkedHashMap<>();
        for (String env : keys.getEnvironments()) {
            used.put(env, value(keys.usedKey(env)));
        }
        return new QuotaUsageSnapshot(value(keys.globalKey()), used);
    }

    @Override
    public synchronized boolean compareAndIncrement(QuotaKeys keys, QuotaUsageSnapshot expected, String environment, long amount) {
        if (!keys.getEnvironments().contains(environment)) {
            throw new IllegalArgumentException("Environment " + environment + " is not covered by the quota keys");
        }
        if (!read(keys).equals(expected)) {
            return false;
        }
        increment(keys.globalKey(), amount);
        increment(keys.usedKey(environment), amount);
        return true;
    }

    @Override
    public synchronized void reset(QuotaKeys keys, String environment) {
        if (environment == null) {
            entries.keySet().removeIf(keys::isUsedKeyOfDay);
            return;
        }
        long cleared = value(keys.usedKey(environment));
        entries.remove(keys.usedKey(environment));
        if (cleared > 0) {
            increment(keys.globalKey(), -cleared);
        }
    }

    @Override
    public synchronized Map<String, Long> readAllocationOverrides(QuotaKeys keys) {
        purgeExpired();
        Map<String, Long> overrides = new LinkedHashMap<>();
        for (String env : keys.getEnvironments()) {
            Entry entry = entries.get(keys.allocationKey(env));
            if (entry != null) {
                overrides.put(env, entry.value);
            }
        }
        return overrides;
    }

    @Override
    public synchronized void writeAllocationOverride(QuotaKeys keys, String environment, long allocated) {
        entries.put(keys.allocationKey(environment), new Entry(allocated, clock.instant().plus(keyTtl)));
    }

    @Override
    public boolean isDistributed() {
        return false;
    }

    private long value(String key) {
        Entry entry = entries.get(key);
        return entry == null ? 0L : entry.value;
    }

    private void increment(String key, long amount) {
        Entry entry = entries.get(key);
        if (entry == null) {
            entries.put(key, new Entry(amount, clock.instant().plus(keyTtl)));
        } else {
            entry.value += amount;
        }
    }

    private void purgeExpired() {
        Instant now = clock.instant();
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (!it.next().expiresAt.isAfter(now)) {
                it.remove();
            }
        }
    }

    private static final class Entry {
        private long value;
        private final Instant expiresAt;

        private Entry(long value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
