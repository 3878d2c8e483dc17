package com.example.admission.config;

import com.example.admission.model.EnvironmentAllocation;
import com.example.admission.model.QuotaAllocation;
import com.example.admission.retry.RetryStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "admission")
public class AdmissionProperties {

    /**
     * Identity of this deployment (prod, test, dev, e2e...). Each environment draws on its own quota allocation.
     */
    private String environment = "dev";

    /**
     * Longest the executor will block waiting for a rate limit window before giving up with a RateLimitException.
     */
    private Duration rateLimitMaxWait = Duration.ofMinutes(5);

    private Quota quota = new Quota();

    /**
     * Sliding-window limits keyed by provider name.
     */
    private Map<String, RateLimit> rateLimits = new LinkedHashMap<>();

    private Breakers circuitBreaker = new Breakers();

    private Retry retry = new Retry();

    private Recovery recovery = new Recovery();

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public Duration getRateLimitMaxWait() {
        return rateLimitMaxWait;
    }

    public void setRateLimitMaxWait(Duration rateLimitMaxWait) {
        this.rateLimitMaxWait = rateLimitMaxWait;
    }

    public Quota getQuota() {
        return quota;
    }

    public void setQuota(Quota quota) {
        this.quota = quota;
    }

    public Map<String, RateLimit> getRateLimits() {
        return rateLimits;
    }

    public void setRateLimits(Map<String, RateLimit> rateLimits) {
        this.rateLimits = rateLimits;
    }

    public Breakers getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(Breakers circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public enum StoreType {
        /**
         * Shared Redis counters; the global ceiling holds across every process and host.
         */
        REDIS,

        /**
         * Process-local counters; the global ceiling only holds within this one process.
         */
        IN_MEMORY
    }

    public static class Quota {

        /**
         * Metered provider whose subscription the environments share.
         */
        private String provider = "barchart";

        private long totalDailyLimit = 250;

        private Map<String, Allocation> allocations = new LinkedHashMap<>();

        /**
         * Expiry applied to every daily counter key.
         */
        private Duration keyTtl = Duration.ofHours(24);

        /**
         * Compare-and-increment rounds before a contended request is denied.
         */
        private int maxCasAttempts = 16;

        private StoreType store = StoreType.REDIS;

        public QuotaAllocation toAllocation() {
            Map<String, EnvironmentAllocation> table = new LinkedHashMap<>();
            allocations.forEach((name, allocation) ->
                    table.put(name, new EnvironmentAllocation(allocation.getAllocated(), allocation.getPriority())));
            return new QuotaAllocation(totalDailyLimit, table);
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public long getTotalDailyLimit() {
            return totalDailyLimit;
        }

        public void setTotalDailyLimit(long totalDailyLimit) {
            this.totalDailyLimit = totalDailyLimit;
        }

        public Map<String, Allocation> getAllocations() {
            return allocations;
        }

        public void setAllocations(Map<String, Allocation> allocations) {
            this.allocations = allocations;
        }

        public Duration getKeyTtl() {
            return keyTtl;
        }

        public void setKeyTtl(Duration keyTtl) {
            this.keyTtl = keyTtl;
        }

        public int getMaxCasAttempts() {
            return maxCasAttempts;
        }

        public void setMaxCasAttempts(int maxCasAttempts) {
            this.maxCasAttempts = maxCasAttempts;
        }

        public StoreType getStore() {
            return store;
        }

        public void setStore(StoreType store) {
            this.store = store;
        }
    }

    public static class Allocation {

        private long allocated;

        /**
         * 1 is the highest priority.
         */
        private int priority = 1;

        public Allocation() {
        }

        public Allocation(long allocated, int priority) {
            this.allocated = allocated;
            this.priority = priority;
        }

        public long getAllocated() {
            return allocated;
        }

        public void setAllocated(long allocated) {
            this.allocated = allocated;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }
    }

    /**
     * Unset windows are not enforced.
     */
    public static class RateLimit {

        private Integer requestsPerDay;
        private Integer requestsPerHour;
        private Integer requestsPerMinute;

        /**
         * Requests allowed within a 10 second burst window.
         */
        private Integer burstLimit;

        public Integer getRequestsPerDay() {
            return requestsPerDay;
        }

        public void setRequestsPerDay(Integer requestsPerDay) {
            this.requestsPerDay = requestsPerDay;
        }

        public Integer getRequestsPerHour() {
            return requestsPerHour;
        }

        public void setRequestsPerHour(Integer requestsPerHour) {
            this.requestsPerHour = requestsPerHour;
        }

        public Integer getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(Integer requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
        }

        public Integer getBurstLimit() {
            return burstLimit;
        }

        public void setBurstLimit(Integer burstLimit) {
            this.burstLimit = burstLimit;
        }
    }

    public static class Breakers {

        private BreakerSettings defaults = new BreakerSettings();

        /**
         * Overrides keyed by breaker name, e.g. {@code provider_barchart}.
         */
        private Map<String, BreakerSettings> instances = new LinkedHashMap<>();

        public BreakerSettings getDefaults() {
            return defaults;
        }

        public void setDefaults(BreakerSettings defaults) {
            this.defaults = defaults;
        }

        public Map<String, BreakerSettings> getInstances() {
            return instances;
        }

        public void setInstances(Map<String, BreakerSettings> instances) {
            this.instances = instances;
        }
    }

    public static class BreakerSettings {

        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(60);
        private int successThreshold = 3;
        private int slidingWindowSize = 100;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }

        public int getSlidingWindowSize() {
            return slidingWindowSize;
        }

        public void setSlidingWindowSize(int slidingWindowSize) {
            this.slidingWindowSize = slidingWindowSize;
        }
    }

    public static class Retry {

        private RetrySettings defaults = new RetrySettings();

        /**
         * Per-provider overrides, layered over the built-in provider presets.
         */
        private Map<String, RetrySettings> providers = new LinkedHashMap<>();

        public RetrySettings getDefaults() {
            return defaults;
        }

        public void setDefaults(RetrySettings defaults) {
            this.defaults = defaults;
        }

        public Map<String, RetrySettings> getProviders() {
            return providers;
        }

        public void setProviders(Map<String, RetrySettings> providers) {
            this.providers = providers;
        }
    }

    /**
     * Unset fields inherit from the provider preset, then from the built-in default policy.
     */
    public static class RetrySettings {

        private Integer maxAttempts;
        private RetryStrategy strategy;
        private Duration baseDelay;
        private Duration maxDelay;
        private Double rateLimitBackoffMultiplier;
        private Boolean respectRetryAfter;

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public RetryStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(RetryStrategy strategy) {
            this.strategy = strategy;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Double getRateLimitBackoffMultiplier() {
            return rateLimitBackoffMultiplier;
        }

        public void setRateLimitBackoffMultiplier(Double rateLimitBackoffMultiplier) {
            this.rateLimitBackoffMultiplier = rateLimitBackoffMultiplier;
        }

        public Boolean getRespectRetryAfter() {
            return respectRetryAfter;
        }

        public void setRespectRetryAfter(Boolean respectRetryAfter) {
            this.respectRetryAfter = respectRetryAfter;
        }
    }

    public static class Recovery {

        /**
         * Alternate providers, in the order they are tried, keyed by primary provider.
         */
        private Map<String, List<String>> fallbackProviders = new LinkedHashMap<>();

        public List<String> fallbacksFor(String provider) {
            return fallbackProviders.getOrDefault(provider, new ArrayList<>());
        }

        public Map<String, List<String>> getFallbackProviders() {
            return fallbackProviders;
        }

        public void setFallbackProviders(Map<String, List<String>> fallbackProviders) {
            this.fallbackProviders = fallbackProviders;
        }
    }
}
