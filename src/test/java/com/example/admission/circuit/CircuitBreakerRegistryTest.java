package com.example.admission.circuit;

import com.example.admission.config.AdmissionProperties;
import com.example.admission.model.HealthReport;
import com.example.admission.model.HealthStatus;
import com.example.admission.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerRegistryTest {

    private final MutableClock clock = MutableClock.at("2024-03-01T10:00:00Z");

    @Test
    void sameNameReturnsSameBreaker() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(new AdmissionProperties(), clock);
        assertSame(registry.breaker("provider_yahoo"), registry.breaker("provider_yahoo"));
        assertEquals("provider_yahoo", CircuitBreakerRegistry.providerBreakerName("yahoo"));
    }

    @Test
    void instanceSettingsOverrideDefaults() {
        AdmissionProperties properties = new AdmissionProperties();
        AdmissionProperties.BreakerSettings barchart = new AdmissionProperties.BreakerSettings();
        barchart.setFailureThreshold(2);
        barchart.setRecoveryTimeout(Duration.ofSeconds(120));
        properties.getCircuitBreaker().getInstances().put("provider_barchart", barchart);

        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(properties, clock);

        assertEquals(2, registry.breaker("provider_barchart").getConfig().getFailureThreshold());
        assertEquals(5, registry.breaker("provider_yahoo").getConfig().getFailureThreshold());
    }

    @Test
    void healthScoreReflectsOpenCircuits() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(new AdmissionProperties(), clock);
        assertEquals(HealthStatus.HEALTHY, registry.health().getStatus());

        registry.breaker("provider_barchart");
        registry.breaker("provider_yahoo");
        registry.breaker("provider_ibkr").forceOpen();

        HealthReport report = registry.health();
        assertEquals(3, report.getTotalBreakers());
        assertEquals(1, report.getFailing());
        assertEquals(200.0 / 3, report.getScore(), 0.001);
        assertEquals(HealthStatus.UNHEALTHY, report.getStatus());
        assertEquals(List.of("provider_ibkr"), registry.failingBreakers());
        assertEquals(List.of("provider_barchart", "provider_yahoo"), registry.healthyBreakers());

        registry.resetAll();
        assertEquals(HealthStatus.HEALTHY, registry.health().getStatus());
    }

    @Test
    void resetUnknownBreakerReportsFalse() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(new AdmissionProperties(), clock);
        assertFalse(registry.reset("provider_missing"));
        assertTrue(registry.find("provider_missing").isEmpty());
    }
}
