package com.example.admission.model;

import java.util.Objects;

/**
 * Guaranteed daily share of one environment. Priority 1 is the highest.
 */
public final class EnvironmentAllocation {

    private final long allocated;
    private final int priority;

    public EnvironmentAllocation(long allocated, int priority) {
        if (allocated < 0) {
            throw new IllegalArgumentException("allocated < 0");
        }
        if (priority < 1) {
            throw new IllegalArgumentException("priority < 1");
        }
        this.allocated = allocated;
        this.priority = priority;
    }

    public long getAllocated() {
        return allocated;
    }

    public int getPriority() {
        return priority;
    }

    public EnvironmentAllocation withAllocated(long newAllocated) {
        return new EnvironmentAllocation(newAllocated, priority);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnvironmentAllocation that)) return false;
        return allocated == that.allocated && priority == that.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(allocated, priority);
    }

    @Override
    public String toString() {
        return allocated + "@p" + priority;
    }
}
