package com.example.admission.retry;

import com.example.admission.exception.CircuitOpenException;
import com.example.admission.exception.FatalProviderException;
import com.example.admission.exception.QuotaExceededException;
import com.example.admission.exception.RateLimitException;
import com.example.admission.exception.TransientProviderException;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;

/**
 * Immutable retry configuration: attempt budget, backoff shape and which failures are worth retrying.
 * Built once and shared across calls.
 */
public final class RetryPolicy {

    public static final Set<Class<? extends Throwable>> DEFAULT_RETRYABLE = Set.of(
            TransientProviderException.class,
            RateLimitException.class,
            IOException.class,
            TimeoutException.class
    );

    public static final Set<Class<? extends Throwable>> DEFAULT_NON_RETRYABLE = Set.of(
            FatalProviderException.class,
            QuotaExceededException.class,
            CircuitOpenException.class
    );

    private final int maxAttempts;
    private final RetryStrategy strategy;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Set<Class<? extends Throwable>> retryable;
    private final Set<Class<? extends Throwable>> nonRetryable;
    private final double rateLimitBackoffMultiplier;
    private final boolean respectRetryAfter;

    private RetryPolicy(Builder builder) {
        if (builder.maxAttempts < 1) throw new IllegalArgumentException("maxAttempts < 1");
        if (builder.baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay < 0");
        if (builder.maxDelay.compareTo(builder.baseDelay) < 0) throw new IllegalArgumentException("maxDelay < baseDelay");
        this.maxAttempts = builder.maxAttempts;
        this.strategy = builder.strategy;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.retryable = Set.copyOf(builder.retryable);
        this.nonRetryable = Set.copyOf(builder.nonRetryable);
        this.rateLimitBackoffMultiplier = builder.rateLimitBackoffMultiplier;
        this.respectRetryAfter = builder.respectRetryAfter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .strategy(strategy)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .retryOn(retryable)
                .abortOn(nonRetryable)
                .rateLimitBackoffMultiplier(rateLimitBackoffMultiplier)
                .respectRetryAfter(respectRetryAfter);
    }

    /**
     * Non-retryable kinds win when a failure matches both sets; unknown failures are not retried.
     */
    public boolean isRetryable(Throwable failure) {
        if (matches(nonRetryable, failure)) {
            return false;
        }
        return matches(retryable, failure);
    }

    private static boolean matches(Set<Class<? extends Throwable>> kinds, Throwable failure) {
        for (Class<? extends Throwable> kind : kinds) {
            if (kind.isInstance(failure)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Delay from the strategy alone, before jitter, clamped to {@code maxDelay}.
     */
    public Duration computeDelay(int attempt) {
        double nanos = baseDelay.toNanos() * strategy.multiplier(attempt);
        return Duration.ofNanos((long) Math.min(nanos, (double) maxDelay.toNanos()));
    }

    /**
     * Delay to wait after failed attempt {@code attempt}.
     * A rate-limited failure with a known retry-after waits that long (scaled by the rate limit
     * multiplier) instead; jittered strategies scale the clamped delay by a factor in [0.5, 1.0].
     */
    public Duration delayFor(int attempt, Throwable failure, DoubleSupplier random) {
        if (respectRetryAfter && failure instanceof RateLimitException rateLimited
                && !rateLimited.getRetryAfter().isZero()) {
            double nanos = rateLimited.getRetryAfter().toNanos() * rateLimitBackoffMultiplier;
            return Duration.ofNanos((long) Math.min(nanos, (double) maxDelay.toNanos()));
        }
        Duration delay = computeDelay(attempt);
        if (strategy.jittered()) {
            double factor = 0.5 + 0.5 * random.getAsDouble();
            delay = Duration.ofNanos((long) (delay.toNanos() * factor));
        }
        return delay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public RetryStrategy getStrategy() {
        return strategy;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public Set<Class<? extends Throwable>> getRetryable() {
        return retryable;
    }

    public Set<Class<? extends Throwable>> getNonRetryable() {
        return nonRetryable;
    }

    public double getRateLimitBackoffMultiplier() {
        return rateLimitBackoffMultiplier;
    }

    public boolean isRespectRetryAfter() {
        return respectRetryAfter;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" + strategy + ", maxAttempts=" + maxAttempts +
                ", baseDelay=" + baseDelay + ", maxDelay=" + maxDelay + '}';
    }

    public static final class Builder {

        private int maxAttempts = 3;
        private RetryStrategy strategy = RetryStrategy.EXPONENTIAL_BACKOFF_JITTER;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private Set<Class<? extends Throwable>> retryable = new LinkedHashSet<>(DEFAULT_RETRYABLE);
        private Set<Class<? extends Throwable>> nonRetryable = new LinkedHashSet<>(DEFAULT_NON_RETRYABLE);
        private double rateLimitBackoffMultiplier = 1.5;
        private boolean respectRetryAfter = true;

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder strategy(RetryStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * Replaces the retryable set.
         */
        public Builder retryOn(Set<Class<? extends Throwable>> kinds) {
            this.retryable = new LinkedHashSet<>(kinds);
            return this;
        }

        /**
         * Replaces the non-retryable set.
         */
        public Builder abortOn(Set<Class<? extends Throwable>> kinds) {
            this.nonRetryable = new LinkedHashSet<>(kinds);
            return this;
        }

        @SafeVarargs
        public final Builder alsoRetryOn(Class<? extends Throwable>... kinds) {
            this.retryable.addAll(List.of(kinds));
            return this;
        }

        @SafeVarargs
        public final Builder alsoAbortOn(Class<? extends Throwable>... kinds) {
            this.nonRetryable.addAll(List.of(kinds));
            return this;
        }

        public Builder rateLimitBackoffMultiplier(double multiplier) {
            this.rateLimitBackoffMultiplier = multiplier;
            return this;
        }

        public Builder respectRetryAfter(boolean respectRetryAfter) {
            this.respectRetryAfter = respectRetryAfter;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
