package com.example.admission.model;

import java.util.Objects;

/**
 * Today's quota position of one environment.
 */
public final class EnvironmentQuotaStatus {

    private final String environment;
    private final long allocated;
    private final long used;
    private final int priority;

    public EnvironmentQuotaStatus(String environment, long allocated, long used, int priority) {
        this.environment = environment;
        this.allocated = allocated;
        this.used = used;
        this.priority = priority;
    }

    public String getEnvironment() {
        return environment;
    }

    public long getAllocated() {
        return allocated;
    }

    public long getUsed() {
        return used;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Negative once the environment has consumed spillover.
     */
    public long getAvailable() {
        return allocated - used;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnvironmentQuotaStatus that)) return false;
        return allocated == that.allocated && used == that.used && priority == that.priority
                && environment.equals(that.environment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(environment, allocated, used, priority);
    }

    @Override
    public String toString() {
        return environment + ": " + used + "/" + allocated + " (priority " + priority + ")";
    }
}
