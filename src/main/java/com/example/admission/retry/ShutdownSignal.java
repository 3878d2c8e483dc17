package com.example.admission.retry;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide cancellation token, tripped when the application context shuts down.
 * Sleeping workers wake immediately so the process can terminate without finishing long backoffs.
 */
@Component
public class ShutdownSignal {

    private static final Logger log = LoggerFactory.getLogger(ShutdownSignal.class);

    private final CountDownLatch latch = new CountDownLatch(1);

    @PreDestroy
    public void trigger() {
        if (latch.getCount() > 0) {
            log.info("Shutdown signalled, aborting pending waits");
            latch.countDown();
        }
    }

    public boolean isTriggered() {
        return latch.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for shutdown.
     *
     * @return true if shutdown was signalled, false if the timeout elapsed first
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
