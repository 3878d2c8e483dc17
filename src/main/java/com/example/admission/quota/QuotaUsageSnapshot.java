package com.example.admission.quota;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Counter values read from the store at one moment; also the expected values of a compare-and-increment.
 */
public final class QuotaUsageSnapshot {

    private final long globalUsed;
    private final Map<String, Long> environmentUsed;

    public QuotaUsageSnapshot(long globalUsed, Map<String, Long> environmentUsed) {
        this.globalUsed = globalUsed;
        this.environmentUsed = Collections.unmodifiableMap(new LinkedHashMap<>(environmentUsed));
    }

    public long getGlobalUsed() {
        return globalUsed;
    }

    public long usedBy(String environment) {
        return environmentUsed.getOrDefault(environment, 0L);
    }

    public Map<String, Long> getEnvironmentUsed() {
        return environmentUsed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuotaUsageSnapshot that)) return false;
        return globalUsed == that.globalUsed && environmentUsed.equals(that.environmentUsed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(globalUsed, environmentUsed);
    }

    @Override
    public String toString() {
        return "global=" + globalUsed + " " + environmentUsed;
    }
}
