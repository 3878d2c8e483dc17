package com.example.admission.ratelimit;

import com.example.admission.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProviderRateLimiterTest {

    @Test
    void minuteWindowSlides() {
        MutableClock clock = MutableClock.at("2024-03-01T10:00:00Z");
        ProviderRateLimiter limiter = ProviderRateLimiter.builder("barchart", clock).requestsPerMinute(2).build();

        assertTrue(limiter.tryAcquire());          // t=0s
        clock.advanceSeconds(10);
        assertTrue(limiter.tryAcquire());          // t=10s
        clock.advanceSeconds(10);
        assertFalse(limiter.canMakeRequest());     // t=20s
        assertEquals(Duration.ofSeconds(40), limiter.getWaitTime());

        clock.advanceSeconds(41);                  // t=61s
        assertTrue(limiter.canMakeRequest());
        assertEquals(Duration.ZERO, limiter.getWaitTime());
    }

    @Test
    void everyWindowMustHaveRoom() {
        MutableClock clock = MutableClock.at("2024-03-01T10:00:00Z");
        ProviderRateLimiter limiter = ProviderRateLimiter.builder("yahoo", clock)
                .burstLimit(2)
                .requestsPerMinute(3)
                .build();

        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
        assertEquals(Duration.ofSeconds(10), limiter.getWaitTime());

        clock.advanceSeconds(10);
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
        // burst has room again, minute is saturated until t=60s
        assertEquals(Duration.ofSeconds(50), limiter.getWaitTime());
    }

    @Test
    void waitTimeIsMinimumAcrossSaturatedWindows() {
        MutableClock clock = MutableClock.at("2024-03-01T10:00:00Z");
        ProviderRateLimiter limiter = ProviderRateLimiter.builder("ibkr", clock)
                .burstLimit(1)
                .requestsPerHour(1)
                .build();

        limiter.recordRequest();
        assertEquals(Duration.ofSeconds(10), limiter.getWaitTime());
    }

    @Test
    void unconfiguredLimiterNeverBlocks() {
        ProviderRateLimiter limiter = ProviderRateLimiter.builder("local", MutableClock.at("2024-03-01T00:00:00Z"))
                .requestsPerMinute(null)
                .build();

        assertTrue(limiter.isUnlimited());
        for (int i = 0; i < 1_000; i++) {
            assertTrue(limiter.tryAcquire());
        }
        assertEquals(Duration.ZERO, limiter.getWaitTime());
    }

    @Test
    void usageReportsCountPerWindow() {
        MutableClock clock = MutableClock.at("2024-03-01T10:00:00Z");
        ProviderRateLimiter limiter = ProviderRateLimiter.builder("barchart", clock)
                .requestsPerMinute(10)
                .requestsPerDay(250)
                .build();
        limiter.tryAcquire();
        limiter.tryAcquire();

        assertEquals("2/10", limiter.usage().get("minute"));
        assertEquals("2/250", limiter.usage().get("day"));
    }

    @Test
    void releasedSlotIsAvailableAgain() {
        MutableClock clock = MutableClock.at("2024-03-01T10:00:00Z");
        ProviderRateLimiter limiter = ProviderRateLimiter.builder("barchart", clock)
                .requestsPerMinute(2).requestsPerHour(5).build();

        assertTrue(limiter.tryAcquire());
        clock.advanceSeconds(5);
        OptionalLong slot = limiter.acquire();
        assertTrue(slot.isPresent());
        assertFalse(limiter.canMakeRequest());

        limiter.release(slot.getAsLong());

        assertEquals("1/2", limiter.usage().get("minute"));
        assertEquals("1/5", limiter.usage().get("hour"));
        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.acquire().isEmpty());
    }

    @Test
    void concurrentCallersNeverExceedLimit() throws InterruptedException {
        MutableClock clock = MutableClock.at("2024-03-01T10:00:00Z");
        ProviderRateLimiter limiter = ProviderRateLimiter.builder("barchart", clock).requestsPerMinute(25).build();

        int threads = 16;
        int attemptsPerThread = 10;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger admitted = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int j = 0; j < attemptsPerThread; j++) {
                        if (limiter.tryAcquire()) {
                            admitted.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(5, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(25, admitted.get());
    }
}
