package com.example.admission.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Multi-window sliding log rate limiter for one provider.
 * <p>
 * A request is allowed only when every configured window (burst, minute, hour, day) has room.
 * Windows are kept shortest first. All methods synchronize on the limiter, so
 * evict-check-record in {@link #tryAcquire()} is a single step.
 */
public final class ProviderRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(ProviderRateLimiter.class);

    public static final Duration BURST_WINDOW = Duration.ofSeconds(10);

    private final String provider;
    private final Clock clock;
    private final List<RateLimitWindow> windows;

    private ProviderRateLimiter(String provider, Clock clock, List<RateLimitWindow> windows) {
        this.provider = provider;
        this.clock = clock;
        List<RateLimitWindow> sorted = new ArrayList<>(windows);
        sorted.sort(Comparator.comparingLong(RateLimitWindow::lengthMillis));
        this.windows = sorted;
    }

    public static Builder builder(String provider, Clock clock) {
        return new Builder(provider, clock);
    }

    public synchronized boolean canMakeRequest() {
        long now = clock.millis();
        for (RateLimitWindow window : windows) {
            window.evict(now);
            if (window.isSaturated()) {
                return false;
            }
        }
        return true;
    }

    public synchronized void recordRequest() {
        long now = clock.millis();
        for (RateLimitWindow window : windows) {
            window.record(now);
        }
    }

    /**
     * Checks every window and, if all have room, records the request.
     *
     * @return true if the request was admitted and recorded
     */
    public synchronized boolean tryAcquire() {
        return acquire().isPresent();
    }

    /**
     * Like {@link #tryAcquire()}, but returns the recorded timestamp so an unused slot can be
     * handed back with {@link #release(long)}.
     *
     * @return epoch millis of the recorded request, or empty if any window is saturated
     */
    public synchronized OptionalLong acquire() {
        if (!canMakeRequest()) {
            log.debug("Rate limit reached for provider {}", provider);
            return OptionalLong.empty();
        }
        long now = clock.millis();
        for (RateLimitWindow window : windows) {
            window.record(now);
        }
        return OptionalLong.of(now);
    }

    /**
     * Removes a request recorded by {@link #acquire()} that was never sent.
     */
    public synchronized void release(long recordedAt) {
        for (RateLimitWindow window : windows) {
            window.remove(recordedAt);
        }
    }

    /**
     * @return zero when a request may go now, otherwise the smallest non-zero wait among saturated windows
     */
    public synchronized Duration getWaitTime() {
        long now = clock.millis();
        long best = 0L;
        for (RateLimitWindow window : windows) {
            window.evict(now);
            long wait = window.waitMillis(now);
            if (wait > 0 && (best == 0L || wait < best)) {
                best = wait;
            }
        }
        return Duration.ofMillis(best);
    }

    /**
     * Current count per window, keyed by window name.
     */
    public synchronized Map<String, String> usage() {
        long now = clock.millis();
        Map<String, String> usage = new LinkedHashMap<>();
        for (RateLimitWindow window : windows) {
            window.evict(now);
            usage.put(window.name(), window.count() + "/" + window.limit());
        }
        return usage;
    }

    public String getProvider() {
        return provider;
    }

    public boolean isUnlimited() {
        return windows.isEmpty();
    }

    public static final class Builder {

        private final String provider;
        private final Clock clock;
        private final List<RateLimitWindow> windows = new ArrayList<>();

        private Builder(String provider, Clock clock) {
            this.provider = provider;
            this.clock = clock;
        }

        public Builder requestsPerDay(Integer limit) {
            return window("day", Duration.ofDays(1), limit);
        }

        public Builder requestsPerHour(Integer limit) {
            return window("hour", Duration.ofHours(1), limit);
        }

        public Builder requestsPerMinute(Integer limit) {
            return window("minute", Duration.ofMinutes(1), limit);
        }

        public Builder burstLimit(Integer limit) {
            return window("burst", BURST_WINDOW, limit);
        }

        public Builder window(String name, Duration length, Integer limit) {
            if (limit != null) {
                windows.add(new RateLimitWindow(name, length, limit));
            }
            return this;
        }

        public ProviderRateLimiter build() {
            return new ProviderRateLimiter(provider, clock, windows);
        }
    }
}
