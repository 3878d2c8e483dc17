package com.example.admission.service;

import com.example.admission.circuit.CircuitBreaker;
import com.example.admission.circuit.CircuitBreakerRegistry;
import com.example.admission.config.AdmissionProperties;
import com.example.admission.correlation.CorrelationContext;
import com.example.admission.correlation.CorrelationScope;
import com.example.admission.exception.OperationCancelledException;
import com.example.admission.exception.QuotaExceededException;
import com.example.admission.exception.RateLimitException;
import com.example.admission.exception.RecoveryFailedException;
import com.example.admission.model.QuotaResult;
import com.example.admission.quota.QuotaManager;
import com.example.admission.ratelimit.ProviderRateLimiter;
import com.example.admission.ratelimit.RateLimiterRegistry;
import com.example.admission.recovery.ErrorRecoveryManager;
import com.example.admission.recovery.ProviderCall;
import com.example.admission.recovery.RecoveryContext;
import com.example.admission.recovery.RecoveryResult;
import com.example.admission.retry.BackoffSleeper;
import com.example.admission.retry.RetryPolicyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * Runs one provider request through the full admission and resilience pipeline:
 * <ol>
 *   <li>circuit pre-check</li>
 *   <li>rate limit wait</li>
 *   <li>circuit permission</li>
 *   <li>daily quota, when the provider is the metered one</li>
 *   <li>the call itself, under that permission</li>
 * </ol>
 * Quota is charged last, so it is only spent on attempts that reach the provider. When a later
 * step refuses, the rate limit slot and circuit permission are handed back.
 * Each attempt is retried under the provider's retry policy. A request that still fails goes to
 * the {@link ErrorRecoveryManager}; fallback providers run through the same pipeline.
 */
@Service
public class ProviderRequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProviderRequestExecutor.class);

    private final AdmissionProperties properties;
    private final QuotaManager quotaManager;
    private final RateLimiterRegistry rateLimiters;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RetryPolicyRegistry retryPolicies;
    private final ErrorRecoveryManager recoveryManager;
    private final BackoffSleeper sleeper;

    public ProviderRequestExecutor(AdmissionProperties properties,
                                   QuotaManager quotaManager,
                                   RateLimiterRegistry rateLimiters,
                                   CircuitBreakerRegistry circuitBreakers,
                                   RetryPolicyRegistry retryPolicies,
                                   ErrorRecoveryManager recoveryManager,
                                   BackoffSleeper sleeper) {
        this.properties = properties;
        this.quotaManager = quotaManager;
        this.rateLimiters = rateLimiters;
        this.circuitBreakers = circuitBreakers;
        this.retryPolicies = retryPolicies;
        this.recoveryManager = recoveryManager;
        this.sleeper = sleeper;
    }

    /**
     * @throws RecoveryFailedException    when the request and every recovery strategy failed
     * @throws OperationCancelledException when a wait was aborted by shutdown or interrupt
     */
    public <T> T execute(ProviderRequest<T> request) {
        String environment = request.getEnvironment() != null ? request.getEnvironment() : properties.getEnvironment();
        try (CorrelationScope scope = CorrelationContext.open(request.getOperationName(), request.getCorrelationId())) {
            CorrelationContext context = scope.context();
            context.put("provider", request.getProvider()).put("environment", environment);
            request.getMetadata().forEach(context::put);

            ProviderCall<T> guarded = provider -> executeWithRetry(request, provider, environment);
            try {
                return guarded.call(request.getProvider());
            } catch (OperationCancelledException ex) {
                throw ex;
            } catch (Exception ex) {
                log.warn("{} failed against {}: {}", request.getOperationName(), request.getProvider(), ex.toString());
                RecoveryContext<T> recoveryContext = new RecoveryContext<>(request.getOperationName(),
                        request.getProvider(), environment, context, request.getDegraded());
                RecoveryResult<T> result = recoveryManager.attemptRecovery(guarded, ex, recoveryContext);
                if (result.isSuccess()) {
                    return result.getValue();
                }
                throw new RecoveryFailedException(request.getOperationName(), environment, request.getProvider(),
                        result.getAttemptedStrategies(), result.getFinalError().orElse(ex));
            }
        }
    }

    private <T> T executeWithRetry(ProviderRequest<T> request, String provider, String environment) throws Exception {
        String operation = request.getOperationName() + "@" + provider;
        return retryPolicies.managerFor(provider)
                .execute(operation, () -> attempt(request, provider, environment));
    }

    private <T> T attempt(ProviderRequest<T> request, String provider, String environment) throws Exception {
        CircuitBreaker breaker = circuitBreakers.breaker(CircuitBreakerRegistry.providerBreakerName(provider));
        breaker.checkPermitted();
        ProviderRateLimiter limiter = rateLimiters.limiterFor(provider);
        long slot = awaitRateLimit(limiter);
        CircuitBreaker.Permission permission = null;
        boolean invoked = false;
        try {
            permission = breaker.acquirePermission();
            if (provider.equals(quotaManager.getProvider())) {
                QuotaResult quota = quotaManager.tryRequestQuota(environment, request.getQuotaCost());
                if (!quota.isApproved()) {
                    throw new QuotaExceededException(provider, quota);
                }
            }
            invoked = true;
            return breaker.call(permission, () -> request.getCall().call(provider));
        } finally {
            if (!invoked) {
                // nothing reached the provider
                if (permission != null) {
                    breaker.release(permission);
                }
                limiter.release(slot);
            }
        }
    }

    /**
     * @return the recorded slot, for {@link ProviderRateLimiter#release(long)}
     */
    private long awaitRateLimit(ProviderRateLimiter limiter) {
        Duration maxWait = properties.getRateLimitMaxWait();
        while (true) {
            OptionalLong slot = limiter.acquire();
            if (slot.isPresent()) {
                return slot.getAsLong();
            }
            Duration wait = limiter.getWaitTime();
            if (wait.compareTo(maxWait) > 0) {
                throw new RateLimitException(limiter.getProvider(), wait);
            }
            if (wait.isZero()) {
                wait = Duration.ofMillis(1);
            }
            log.debug("Rate limit for {} saturated, waiting {} ms", limiter.getProvider(), wait.toMillis());
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Rate limit wait for " + limiter.getProvider() + " was cancelled", ex);
            }
        }
    }
}
