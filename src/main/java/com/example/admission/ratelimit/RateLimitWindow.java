package com.example.admission.ratelimit;

import java.time.Duration;
import java.util.ArrayDeque;

/**
 * Exact sliding window (log) of request timestamps, oldest first.
 * Not thread-safe; {@link ProviderRateLimiter} guards every access.
 */
final class RateLimitWindow {

    private final String name;
    private final long lengthMillis;
    private final int limit;
    private final ArrayDeque<Long> timestamps = new ArrayDeque<>();

    RateLimitWindow(String name, Duration length, int limit) {
        if (length.isZero() || length.isNegative()) throw new IllegalArgumentException("window <= 0");
        if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
        this.name = name;
        this.lengthMillis = length.toMillis();
        this.limit = limit;
    }

    void evict(long nowMillis) {
        long cutoff = nowMillis - lengthMillis;
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.removeFirst();
        }
    }

    boolean isSaturated() {
        return timestamps.size() >= limit;
    }

    void record(long nowMillis) {
        timestamps.addLast(nowMillis);
    }

    void remove(long timestamp) {
        timestamps.removeLastOccurrence(timestamp);
    }

    /**
     * Time until the oldest timestamp leaves the window. Call {@link #evict} first.
     */
    long waitMillis(long nowMillis) {
        if (!isSaturated()) {
            return 0L;
        }
        long oldest = timestamps.peekFirst();
        return Math.max(0L, lengthMillis - (nowMillis - oldest));
    }

    String name() {
        return name;
    }

    long lengthMillis() {
        return lengthMillis;
    }

    int limit() {
        return limit;
    }

    int count() {
        return timestamps.size();
    }
}
