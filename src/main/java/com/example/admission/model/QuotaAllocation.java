package com.example.admission.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Total daily limit of a metered provider and its split across environments.
 * <p>
 * Invariant: the sum of all environment allocations never exceeds the total daily limit.
 * Environments missing from the table have no allocation and the lowest priority, so they
 * only ever run on spillover.
 */
public final class QuotaAllocation {

    public static final int UNLISTED_PRIORITY = Integer.MAX_VALUE;

    /**
     * Name of the counter scope shared by all environments; not usable as an environment name.
     */
    public static final String GLOBAL_SCOPE = "global";

    private final long totalDailyLimit;
    private final Map<String, EnvironmentAllocation> environments;

    public QuotaAllocation(long totalDailyLimit, Map<String, EnvironmentAllocation> environments) {
        if (totalDailyLimit < 0) {
            throw new IllegalArgumentException("totalDailyLimit < 0");
        }
        long sum = 0;
        for (Map.Entry<String, EnvironmentAllocation> entry : environments.entrySet()) {
            if (GLOBAL_SCOPE.equals(entry.getKey())) {
                throw new IllegalArgumentException("'" + GLOBAL_SCOPE + "' is reserved and cannot name an environment");
            }
            sum += entry.getValue().getAllocated();
        }
        if (sum > totalDailyLimit) {
            throw new IllegalArgumentException("Sum of allocations " + sum + " exceeds total daily limit " + totalDailyLimit);
        }
        this.totalDailyLimit = totalDailyLimit;
        this.environments = Collections.unmodifiableMap(new LinkedHashMap<>(environments));
    }

    /**
     * Returns a copy with {@code environment}'s allocation replaced.
     *
     * @throws IllegalArgumentException if the new table would exceed the total daily limit
     */
    public QuotaAllocation withAllocation(String environment, long allocated) {
        Map<String, EnvironmentAllocation> copy = new LinkedHashMap<>(environments);
        EnvironmentAllocation current = environments.get(environment);
        int priority = current != null ? current.getPriority() : lowestListedPriority() + 1;
        copy.put(environment, new EnvironmentAllocation(allocated, priority));
        return new QuotaAllocation(totalDailyLimit, copy);
    }

    private int lowestListedPriority() {
        int lowest = 0;
        for (EnvironmentAllocation allocation : environments.values()) {
            lowest = Math.max(lowest, allocation.getPriority());
        }
        return lowest;
    }

    public long getTotalDailyLimit() {
        return totalDailyLimit;
    }

    public long allocatedTo(String environment) {
        EnvironmentAllocation allocation = environments.get(environment);
        return allocation != null ? allocation.getAllocated() : 0L;
    }

    public int priorityOf(String environment) {
        EnvironmentAllocation allocation = environments.get(environment);
        return allocation != null ? allocation.getPriority() : UNLISTED_PRIORITY;
    }

    public long sumAllocated() {
        long sum = 0;
        for (EnvironmentAllocation allocation : environments.values()) {
            sum += allocation.getAllocated();
        }
        return sum;
    }

    public Set<String> environmentNames() {
        return environments.keySet();
    }

    public Map<String, EnvironmentAllocation> getEnvironments() {
        return environments;
    }

    @Override
    public String toString() {
        return "QuotaAllocation{total=" + totalDailyLimit + ", environments=" + environments + '}';
    }
}
