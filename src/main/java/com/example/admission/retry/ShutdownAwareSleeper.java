package com.example.admission.retry;

import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Sleeps on the {@link ShutdownSignal}, so a wait ends early on shutdown or thread interrupt.
 */
@Component
public class ShutdownAwareSleeper implements BackoffSleeper {

    private final ShutdownSignal shutdownSignal;

    public ShutdownAwareSleeper(ShutdownSignal shutdownSignal) {
        this.shutdownSignal = shutdownSignal;
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (shutdownSignal.isTriggered() || shutdownSignal.await(duration)) {
            throw new InterruptedException("shutdown in progress");
        }
    }
}
