package com.example.admission.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ShutdownAwareSleeperTest {

    @Test
    void shortSleepCompletes() throws InterruptedException {
        ShutdownAwareSleeper sleeper = new ShutdownAwareSleeper(new ShutdownSignal());
        sleeper.sleep(Duration.ofMillis(5));
    }

    @Test
    void shutdownWakesSleepingWorker() throws Exception {
        ShutdownSignal signal = new ShutdownSignal();
        ShutdownAwareSleeper sleeper = new ShutdownAwareSleeper(signal);
        CountDownLatch started = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> interrupted = executor.submit(() -> {
                started.countDown();
                try {
                    sleeper.sleep(Duration.ofMinutes(10));
                    return false;
                } catch (InterruptedException e) {
                    return true;
                }
            });
            assertTrue(started.await(5, TimeUnit.SECONDS));
            signal.trigger();
            assertTrue(interrupted.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void sleepAfterShutdownFailsImmediately() {
        ShutdownSignal signal = new ShutdownSignal();
        signal.trigger();
        assertTrue(signal.isTriggered());
        assertThrows(InterruptedException.class, () -> new ShutdownAwareSleeper(signal).sleep(Duration.ofHours(1)));
    }
}
