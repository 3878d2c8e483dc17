package com.example.admission.retry;

import com.example.admission.exception.CircuitOpenException;
import com.example.admission.exception.FailureReason;
import com.example.admission.exception.FatalProviderException;
import com.example.admission.exception.RateLimitException;
import com.example.admission.exception.TransientProviderException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private static RetryPolicy policy(RetryStrategy strategy, Duration base, Duration max) {
        return RetryPolicy.builder().strategy(strategy).baseDelay(base).maxDelay(max).build();
    }

    @Test
    void exponentialDelayDoublesAndIsClamped() {
        RetryPolicy unclamped = policy(RetryStrategy.EXPONENTIAL_BACKOFF, Duration.ofSeconds(1), Duration.ofSeconds(60));
        assertEquals(Duration.ofSeconds(1), unclamped.computeDelay(1));
        assertEquals(Duration.ofSeconds(2), unclamped.computeDelay(2));
        assertEquals(Duration.ofSeconds(4), unclamped.computeDelay(3));

        RetryPolicy clamped = policy(RetryStrategy.EXPONENTIAL_BACKOFF, Duration.ofSeconds(1), Duration.ofSeconds(3));
        assertEquals(Duration.ofSeconds(3), clamped.computeDelay(3));
    }

    @Test
    void fixedAndLinearDelays() {
        RetryPolicy fixed = policy(RetryStrategy.FIXED_DELAY, Duration.ofMillis(500), Duration.ofSeconds(10));
        assertEquals(Duration.ofMillis(500), fixed.computeDelay(4));

        RetryPolicy linear = policy(RetryStrategy.LINEAR_BACKOFF, Duration.ofMillis(1500), Duration.ofSeconds(60));
        assertEquals(Duration.ofMillis(4500), linear.computeDelay(3));
    }

    @Test
    void jitterScalesClampedDelayIntoUpperHalf() {
        RetryPolicy jittered = policy(RetryStrategy.EXPONENTIAL_BACKOFF_JITTER, Duration.ofSeconds(1), Duration.ofSeconds(3));
        Exception failure = new IOException("reset");

        assertEquals(Duration.ofMillis(1500), jittered.delayFor(3, failure, () -> 0.0));
        assertEquals(Duration.ofSeconds(3), jittered.delayFor(3, failure, () -> 1.0));
        assertEquals(Duration.ofMillis(1000), jittered.delayFor(2, failure, () -> 0.0));
    }

    @Test
    void rateLimitRetryAfterOverridesStrategy() {
        RetryPolicy barchart = RetryPolicy.builder()
                .strategy(RetryStrategy.EXPONENTIAL_BACKOFF)
                .baseDelay(Duration.ofSeconds(2))
                .maxDelay(Duration.ofSeconds(120))
                .rateLimitBackoffMultiplier(2.0)
                .build();

        assertEquals(Duration.ofSeconds(60),
                barchart.delayFor(1, new RateLimitException("barchart", Duration.ofSeconds(30)), () -> 0.5));
        assertEquals(Duration.ofSeconds(120),
                barchart.delayFor(1, new RateLimitException("barchart", Duration.ofMinutes(5)), () -> 0.5));

        RetryPolicy ignoring = barchart.toBuilder().respectRetryAfter(false).build();
        assertEquals(Duration.ofSeconds(2),
                ignoring.delayFor(1, new RateLimitException("barchart", Duration.ofSeconds(30)), () -> 0.5));
    }

    @Test
    void classifiesByTaxonomy() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertTrue(policy.isRetryable(new TransientProviderException("yahoo", FailureReason.TIMEOUT, "timed out")));
        assertTrue(policy.isRetryable(new IOException("connection reset")));
        assertFalse(policy.isRetryable(new FatalProviderException("yahoo", FailureReason.AUTHENTICATION, "401")));
        assertFalse(policy.isRetryable(new CircuitOpenException("provider_yahoo", Duration.ofSeconds(5))));
        assertFalse(policy.isRetryable(new IllegalStateException("unknown")));
    }

    @Test
    void nonRetryableWinsWhenBothMatch() {
        RetryPolicy policy = RetryPolicy.builder()
                .alsoRetryOn(IllegalStateException.class)
                .alsoAbortOn(RuntimeException.class)
                .build();

        assertFalse(policy.isRetryable(new IllegalStateException("both")));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.builder().baseDelay(Duration.ofSeconds(10)).maxDelay(Duration.ofSeconds(1)).build());
    }
}
