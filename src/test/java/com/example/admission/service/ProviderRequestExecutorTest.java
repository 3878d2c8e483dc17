package com.example.admission.service;

import com.example.admission.circuit.CircuitBreaker;
import com.example.admission.circuit.CircuitBreakerRegistry;
import com.example.admission.circuit.CircuitState;
import com.example.admission.config.AdmissionProperties;
import com.example.admission.exception.FailureReason;
import com.example.admission.exception.QuotaExceededException;
import com.example.admission.exception.RecoveryFailedException;
import com.example.admission.exception.RetriesExhaustedException;
import com.example.admission.exception.TransientProviderException;
import com.example.admission.quota.InMemoryQuotaCounterStore;
import com.example.admission.quota.QuotaManager;
import com.example.admission.ratelimit.RateLimiterRegistry;
import com.example.admission.recovery.ErrorRecoveryManager;
import com.example.admission.recovery.ProviderCall;
import com.example.admission.recovery.ProviderRecoveryPolicy;
import com.example.admission.recovery.RecoveryStrategy;
import com.example.admission.retry.RetryPolicyRegistry;
import com.example.admission.support.MutableClock;
import com.example.admission.support.QuotaFixtures;
import com.example.admission.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProviderRequestExecutorTest {

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private QuotaManager quotaManager;
    private CircuitBreakerRegistry circuitBreakers;
    private ErrorRecoveryManager recoveryManager;
    private AdmissionProperties.RateLimit barchartLimit;
    private RateLimiterRegistry rateLimiters;
    private ProviderRequestExecutor executor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        sleeper = new RecordingSleeper(clock);

        AdmissionProperties properties = new AdmissionProperties();
        properties.setEnvironment("test");
        barchartLimit = new AdmissionProperties.RateLimit();
        barchartLimit.setRequestsPerMinute(2);
        properties.getRateLimits().put("barchart", barchartLimit);
        properties.getRecovery().getFallbackProviders().put("barchart", List.of("yahoo"));

        quotaManager = new QuotaManager("barchart", QuotaFixtures.standardAllocation(),
                new InMemoryQuotaCounterStore(clock, Duration.ofHours(24)), clock, 16);
        circuitBreakers = new CircuitBreakerRegistry(properties, clock);
        recoveryManager = new ErrorRecoveryManager(new ProviderRecoveryPolicy(properties), clock);
        rateLimiters = new RateLimiterRegistry(properties, clock);
        executor = new ProviderRequestExecutor(properties, quotaManager, rateLimiters,
                circuitBreakers, new RetryPolicyRegistry(properties, sleeper), recoveryManager, sleeper);
    }

    @Test
    void successfulRequestConsumesQuotaOnce() {
        String result = executor.execute(ProviderRequest.builder("daily-bars", "barchart", provider -> "bars:" + provider)
                .build());

        assertEquals("bars:barchart", result);
        assertEquals(1, quotaManager.getUsageStatus("test").getUsed());
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    void requestWaitsForRateLimitWindow() {
        for (int i = 0; i < 3; i++) {
            executor.execute(ProviderRequest.builder("daily-bars", "barchart", provider -> "bars").build());
        }

        assertEquals(List.of(Duration.ofSeconds(60)), sleeper.getSleeps());
        assertEquals(3, quotaManager.getUsageStatus("test").getUsed());
    }

    @Test
    void unmeteredProviderSkipsQuota() {
        executor.execute(ProviderRequest.builder("quotes", "yahoo", provider -> "quotes").build());
        assertEquals(0, quotaManager.getGlobalStatus().getGlobalUsed());
    }

    @Test
    void transientFailuresAreRetried() {
        AtomicInteger calls = new AtomicInteger();
        String result = executor.execute(ProviderRequest.<String>builder("daily-bars", "yahoo", provider -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientProviderException(provider, FailureReason.SERVER_ERROR, "503");
            }
            return "bars";
        }).build());

        assertEquals("bars", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.getSleeps());
    }

    @Test
    void exhaustedQuotaFallsBackToUnmeteredProvider() {
        assertTrue(quotaManager.requestQuota("prod", 250));
        List<String> called = new ArrayList<>();

        String result = executor.execute(ProviderRequest.<String>builder("daily-bars", "barchart", provider -> {
            called.add(provider);
            return "bars:" + provider;
        }).build());

        assertEquals("bars:yahoo", result);
        assertEquals(List.of("yahoo"), called);
        assertEquals(1L, recoveryManager.getStatistics().get("daily-bars").getSuccessfulRecoveries());
    }

    @Test
    void openCircuitDoesNotSpendQuota() {
        circuitBreakers.breaker(CircuitBreakerRegistry.providerBreakerName("barchart")).forceOpen();

        String result = executor.execute(ProviderRequest.builder("daily-bars", "barchart", provider -> "bars:" + provider)
                .build());

        assertEquals("bars:yahoo", result);
        assertEquals(0, quotaManager.getGlobalStatus().getGlobalUsed());
    }

    @Test
    void saturatedRateLimitDoesNotSpendQuota() {
        barchartLimit.setRequestsPerHour(1);
        List<String> called = new ArrayList<>();
        ProviderCall<String> call = provider -> {
            called.add(provider);
            return "bars:" + provider;
        };

        assertEquals("bars:barchart", executor.execute(ProviderRequest.builder("daily-bars", "barchart", call).build()));
        assertEquals("bars:yahoo", executor.execute(ProviderRequest.builder("daily-bars", "barchart", call).build()));

        assertEquals(List.of("barchart", "yahoo"), called);
        assertEquals(1, quotaManager.getUsageStatus("test").getUsed());
        assertEquals(1, quotaManager.getGlobalStatus().getGlobalUsed());
    }

    @Test
    void quotaDenialHandsBackRateLimitSlot() {
        assertTrue(quotaManager.requestQuota("prod", 250));

        executor.execute(ProviderRequest.builder("daily-bars", "barchart", provider -> "bars:" + provider).build());

        assertEquals("0/2", rateLimiters.limiterFor("barchart").usage().get("minute"));
        assertEquals(0, circuitBreakers.breaker(CircuitBreakerRegistry.providerBreakerName("barchart"))
                .snapshot().getTotalCalls());
    }

    @Test
    void quotaDenialReleasesHalfOpenTrial() {
        CircuitBreaker breaker = circuitBreakers.breaker(CircuitBreakerRegistry.providerBreakerName("barchart"));
        breaker.forceOpen();
        clock.advance(breaker.getConfig().getRecoveryTimeout());
        assertTrue(quotaManager.requestQuota("prod", 250));

        assertEquals("bars:yahoo", executor.execute(
                ProviderRequest.builder("daily-bars", "barchart", provider -> "bars:" + provider).build()));

        assertDoesNotThrow(breaker::checkPermitted);
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
    }

    @Test
    void degradedResultServedWhenProvidersFail() {
        String result = executor.execute(ProviderRequest.<String>builder("daily-bars", "yahoo", provider -> {
            throw new TransientProviderException(provider, FailureReason.CONNECTION, "refused");
        }).degraded(() -> "cached").build());

        assertEquals("cached", result);
    }

    @Test
    void unrecoverableFailureCarriesDiagnostics() {
        assertTrue(quotaManager.requestQuota("prod", 250));

        RecoveryFailedException ex = assertThrows(RecoveryFailedException.class, () -> executor.execute(
                ProviderRequest.<String>builder("daily-bars", "barchart", provider -> {
                    throw new TransientProviderException(provider, FailureReason.TIMEOUT, "timed out");
                }).correlationId("req-42").environment("dev").build()));

        assertEquals("req-42", ex.getCorrelationId());
        assertEquals("dev", ex.getContext().get("environment"));
        assertEquals("barchart", ex.getContext().get("provider"));
        assertEquals(List.of(RecoveryStrategy.PROVIDER_FALLBACK, RecoveryStrategy.MANUAL_INTERVENTION),
                ex.getAttemptedStrategies());
        assertInstanceOf(RetriesExhaustedException.class, ex.getCause());
    }

    @Test
    void quotaDenialIsNotRetried() {
        AdmissionProperties properties = new AdmissionProperties();
        properties.setEnvironment("e2e");
        ProviderRequestExecutor noFallback = new ProviderRequestExecutor(properties, quotaManager,
                new RateLimiterRegistry(properties, clock), circuitBreakers, new RetryPolicyRegistry(properties, sleeper),
                new ErrorRecoveryManager(new ProviderRecoveryPolicy(properties), clock), sleeper);
        assertTrue(quotaManager.requestQuota("prod", 250));

        RecoveryFailedException ex = assertThrows(RecoveryFailedException.class, () -> noFallback.execute(
                ProviderRequest.builder("daily-bars", "barchart", provider -> "bars").build()));

        assertInstanceOf(QuotaExceededException.class, ex.getCause());
        assertTrue(sleeper.getSleeps().isEmpty());
    }
}
