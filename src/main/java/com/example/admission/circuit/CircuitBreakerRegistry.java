package com.example.admission.circuit;

import com.example.admission.config.AdmissionProperties;
import com.example.admission.model.HealthReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Shared by every call site, so all callers of the same logical resource observe the same breaker.
 * Breakers are created on first use and live as long as the registry.
 */
@Component
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final AdmissionProperties properties;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(AdmissionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public static String providerBreakerName(String provider) {
        return "provider_" + provider;
    }

    public CircuitBreaker breaker(String name) {
        return breakers.computeIfAbsent(name, key -> {
            log.info("Created new circuit breaker: {}", key);
            return new CircuitBreaker(key, configFor(key), clock);
        });
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    private CircuitBreakerConfig configFor(String name) {
        AdmissionProperties.Breakers settings = properties.getCircuitBreaker();
        AdmissionProperties.BreakerSettings source = settings.getInstances().getOrDefault(name, settings.getDefaults());
        return new CircuitBreakerConfig(
                source.getFailureThreshold(),
                source.getRecoveryTimeout(),
                source.getSuccessThreshold(),
                source.getSlidingWindowSize()
        );
    }

    /**
     * Snapshots keyed and sorted by breaker name.
     */
    public Map<String, CircuitBreakerSnapshot> snapshots() {
        Map<String, CircuitBreakerSnapshot> result = new TreeMap<>();
        breakers.forEach((name, breaker) -> result.put(name, breaker.snapshot()));
        return result;
    }

    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        log.info("All circuit breakers reset");
    }

    public List<String> healthyBreakers() {
        return namesIn(CircuitState.CLOSED);
    }

    public List<String> failingBreakers() {
        return namesIn(CircuitState.OPEN);
    }

    private List<String> namesIn(CircuitState state) {
        return snapshots().values().stream()
                .filter(snapshot -> snapshot.getState() == state)
                .map(CircuitBreakerSnapshot::getName)
                .collect(Collectors.toList());
    }

    public HealthReport health() {
        Map<String, CircuitBreakerSnapshot> all = snapshots();
        int healthy = 0;
        int failing = 0;
        int testing = 0;
        for (CircuitBreakerSnapshot snapshot : all.values()) {
            switch (snapshot.getState()) {
                case CLOSED:
                    healthy++;
                    break;
                case OPEN:
                    failing++;
                    break;
                default:
                    testing++;
                    break;
            }
        }
        return new HealthReport(all.size(), healthy, failing, testing);
    }
}
