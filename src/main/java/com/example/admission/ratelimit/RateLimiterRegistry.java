package com.example.admission.ratelimit;

import com.example.admission.config.AdmissionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link ProviderRateLimiter} per provider, built from {@code admission.rate-limits.<provider>}.
 * Providers without configuration get a limiter with no windows.
 */
@Component
public class RateLimiterRegistry {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterRegistry.class);

    private final AdmissionProperties properties;
    private final Clock clock;
    private final Map<String, ProviderRateLimiter> limiters = new ConcurrentHashMap<>();

    public RateLimiterRegistry(AdmissionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public ProviderRateLimiter limiterFor(String provider) {
        return limiters.computeIfAbsent(provider, this::create);
    }

    /**
     * Window usage of every configured or already used provider, sorted by provider.
     */
    public Map<String, Map<String, String>> usage() {
        Map<String, Map<String, String>> usage = new TreeMap<>();
        for (String provider : properties.getRateLimits().keySet()) {
            usage.put(provider, limiterFor(provider).usage());
        }
        limiters.forEach((provider, limiter) -> usage.put(provider, limiter.usage()));
        return usage;
    }

    private ProviderRateLimiter create(String provider) {
        AdmissionProperties.RateLimit config = properties.getRateLimits().get(provider);
        ProviderRateLimiter.Builder builder = ProviderRateLimiter.builder(provider, clock);
        if (config != null) {
            builder.requestsPerDay(config.getRequestsPerDay())
                    .requestsPerHour(config.getRequestsPerHour())
                    .requestsPerMinute(config.getRequestsPerMinute())
                    .burstLimit(config.getBurstLimit());
        }
        ProviderRateLimiter limiter = builder.build();
        log.info("Created rate limiter for provider {} (unlimited={})", provider, limiter.isUnlimited());
        return limiter;
    }
}
