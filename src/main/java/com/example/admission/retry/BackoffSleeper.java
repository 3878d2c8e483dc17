package com.example.admission.retry;

import java.time.Duration;

/**
 * Blocks the calling worker for a backoff or rate-limit wait.
 */
@FunctionalInterface
public interface BackoffSleeper {

    /**
     * @throws InterruptedException if the wait was aborted by shutdown or thread interruption
     */
    void sleep(Duration duration) throws InterruptedException;
}
