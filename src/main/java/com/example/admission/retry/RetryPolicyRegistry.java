package com.example.admission.retry;

import com.example.admission.config.AdmissionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the retry policy of each provider: built-in preset, overlaid with
 * {@code admission.retry.defaults} and then {@code admission.retry.providers.<provider>}.
 */
@Component
public class RetryPolicyRegistry {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicyRegistry.class);

    static final Map<String, RetryPolicy> PRESETS = Map.of(
            "barchart", RetryPolicy.builder()
                    .maxAttempts(5)
                    .strategy(RetryStrategy.EXPONENTIAL_BACKOFF_JITTER)
                    .baseDelay(Duration.ofSeconds(2))
                    .maxDelay(Duration.ofSeconds(120))
                    .rateLimitBackoffMultiplier(2.0)
                    .build(),
            "yahoo", RetryPolicy.builder()
                    .maxAttempts(3)
                    .strategy(RetryStrategy.EXPONENTIAL_BACKOFF)
                    .baseDelay(Duration.ofSeconds(1))
                    .maxDelay(Duration.ofSeconds(30))
                    .build(),
            "ibkr", RetryPolicy.builder()
                    .maxAttempts(4)
                    .strategy(RetryStrategy.LINEAR_BACKOFF)
                    .baseDelay(Duration.ofMillis(1500))
                    .maxDelay(Duration.ofSeconds(60))
                    .build()
    );

    private final AdmissionProperties properties;
    private final BackoffSleeper sleeper;
    private final Map<String, RetryManager> managers = new ConcurrentHashMap<>();

    public RetryPolicyRegistry(AdmissionProperties properties, BackoffSleeper sleeper) {
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public RetryPolicy policyFor(String provider) {
        RetryPolicy preset = PRESETS.getOrDefault(provider.toLowerCase(Locale.ROOT), RetryPolicy.defaults());
        RetryPolicy.Builder builder = preset.toBuilder();
        apply(builder, properties.getRetry().getDefaults());
        apply(builder, properties.getRetry().getProviders().get(provider));
        return builder.build();
    }

    public RetryManager managerFor(String provider) {
        return managers.computeIfAbsent(provider, key -> {
            RetryPolicy policy = policyFor(key);
            log.info("Retry policy for provider {}: {}", key, policy);
            return new RetryManager(policy, sleeper);
        });
    }

    private static void apply(RetryPolicy.Builder builder, AdmissionProperties.RetrySettings settings) {
        if (settings == null) {
            return;
        }
        if (settings.getMaxAttempts() != null) builder.maxAttempts(settings.getMaxAttempts());
        if (settings.getStrategy() != null) builder.strategy(settings.getStrategy());
        if (settings.getBaseDelay() != null) builder.baseDelay(settings.getBaseDelay());
        if (settings.getMaxDelay() != null) builder.maxDelay(settings.getMaxDelay());
        if (settings.getRateLimitBackoffMultiplier() != null) {
            builder.rateLimitBackoffMultiplier(settings.getRateLimitBackoffMultiplier());
        }
        if (settings.getRespectRetryAfter() != null) builder.respectRetryAfter(settings.getRespectRetryAfter());
    }
}
