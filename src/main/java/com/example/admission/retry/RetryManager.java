package com.example.admission.retry;

import com.example.admission.exception.OperationCancelledException;
import com.example.admission.exception.RetriesExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Runs an operation under a {@link RetryPolicy}, sleeping between attempts on the caller's thread.
 * <ul>
 *   <li>non-retryable failure: rethrown at once, no delay</li>
 *   <li>retryable failure with attempts left: wait, then try again</li>
 *   <li>retryable failure on the last attempt: {@link RetriesExhaustedException} wrapping it</li>
 *   <li>wait aborted: {@link OperationCancelledException}, thread interrupt flag preserved</li>
 * </ul>
 */
public class RetryManager {

    private static final Logger log = LoggerFactory.getLogger(RetryManager.class);

    private final RetryPolicy policy;
    private final BackoffSleeper sleeper;
    private final DoubleSupplier random;

    public RetryManager(RetryPolicy policy, BackoffSleeper sleeper) {
        this(policy, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryManager(RetryPolicy policy, BackoffSleeper sleeper, DoubleSupplier random) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.random = random;
    }

    public <T> T execute(String operationName, Callable<T> operation) throws Exception {
        for (int attempt = 1; ; attempt++) {
            try {
                T result = operation.call();
                if (attempt > 1) {
                    log.info("{} succeeded after {} attempts", operationName, attempt);
                }
                return result;
            } catch (Exception ex) {
                if (!policy.isRetryable(ex)) {
                    log.info("Not retrying {} after non-retryable {} on attempt {}",
                            operationName, ex.getClass().getSimpleName(), attempt);
                    throw ex;
                }
                if (attempt >= policy.getMaxAttempts()) {
                    log.error("{} failed after all {} attempts: {}", operationName, attempt, ex.toString());
                    throw new RetriesExhaustedException(operationName, attempt, ex);
                }
                Duration delay = policy.delayFor(attempt, ex, random);
                log.warn("{} failed on attempt {}/{} ({}), retrying in {} ms",
                        operationName, attempt, policy.getMaxAttempts(), ex.getClass().getSimpleName(), delay.toMillis());
                pause(operationName, delay);
            }
        }
    }

    /**
     * Wraps {@code operation} so each call runs with retries; same signature as the wrapped operation.
     */
    public <T> Callable<T> wrap(String operationName, Callable<T> operation) {
        return () -> execute(operationName, operation);
    }

    private void pause(String operationName, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Retry backoff for " + operationName + " was cancelled", ex);
        }
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
