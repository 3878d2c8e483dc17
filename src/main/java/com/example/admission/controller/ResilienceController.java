package com.example.admission.controller;

import com.example.admission.circuit.CircuitBreakerRegistry;
import com.example.admission.circuit.CircuitBreakerSnapshot;
import com.example.admission.model.HealthReport;
import com.example.admission.model.HealthStatus;
import com.example.admission.ratelimit.RateLimiterRegistry;
import com.example.admission.recovery.ErrorRecoveryManager;
import com.example.admission.recovery.RecoveryStatistics;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Circuit breaker, rate limiter and recovery state; mirrors the {@code resilience} CLI commands.
 */
@RestController
@RequestMapping("/api/resilience")
public class ResilienceController {

    private final CircuitBreakerRegistry circuitBreakers;
    private final RateLimiterRegistry rateLimiters;
    private final ErrorRecoveryManager recoveryManager;

    public ResilienceController(CircuitBreakerRegistry circuitBreakers,
                                RateLimiterRegistry rateLimiters,
                                ErrorRecoveryManager recoveryManager) {
        this.circuitBreakers = circuitBreakers;
        this.rateLimiters = rateLimiters;
        this.recoveryManager = recoveryManager;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status(@RequestParam(required = false) String provider) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (provider != null) {
            String name = CircuitBreakerRegistry.providerBreakerName(provider);
            body.put("provider", provider);
            body.put("circuitBreaker", circuitBreakers.breaker(name).snapshot());
            body.put("rateLimit", rateLimiters.limiterFor(provider).usage());
            return ResponseEntity.ok(body);
        }
        Map<String, CircuitBreakerSnapshot> snapshots = circuitBreakers.snapshots();
        body.put("circuitBreakers", snapshots);
        body.put("rateLimits", rateLimiters.usage());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = circuitBreakers.health();
        HttpStatus status = report.getStatus() == HealthStatus.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }

    /**
     * Resets one breaker by name, or every breaker when no name is given.
     */
    @PostMapping("/reset")
    public ResponseEntity<Map<String, Object>> reset(@RequestParam(required = false) String name) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (name == null) {
            circuitBreakers.resetAll();
            body.put("reset", "all");
            return ResponseEntity.ok(body);
        }
        if (!circuitBreakers.reset(name)) {
            body.put("error", "Unknown circuit breaker: " + name);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
        body.put("reset", name);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/recovery")
    public ResponseEntity<Map<String, RecoveryStatistics>> recovery() {
        return ResponseEntity.ok(recoveryManager.getStatistics());
    }

    @PostMapping("/recovery/reset")
    public ResponseEntity<Map<String, Object>> resetRecovery() {
        recoveryManager.resetStatistics();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reset", "recovery-statistics");
        return ResponseEntity.ok(body);
    }
}
