package com.example.admission.quota;

import com.example.admission.config.AdmissionProperties;
import com.example.admission.exception.AdmissionException;
import com.example.admission.model.EnvironmentAllocation;
import com.example.admission.model.EnvironmentQuotaStatus;
import com.example.admission.model.GlobalQuotaStatus;
import com.example.admission.model.QuotaAllocation;
import com.example.admission.model.QuotaDecision;
import com.example.admission.model.QuotaResult;
import com.example.admission.model.QuotaStatusReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Admission authority for the shared daily quota of one metered provider.
 * <p>
 * Every decision is taken against one consistent read of the counters and committed with a
 * compare-and-increment; if another writer got there first the whole check is repeated. The
 * global ceiling therefore holds for every writer of the same counter store.
 * <p>
 * Counters are scoped to the current UTC day and expire on their own. When the store cannot
 * be reached, requests are denied (fail closed) rather than over-admitted.
 */
@Service
public class QuotaManager {

    private static final Logger log = LoggerFactory.getLogger(QuotaManager.class);

    private final String provider;
    private final QuotaAllocation baseAllocation;
    private final QuotaCounterStore store;
    private final Clock clock;
    private final int maxCasAttempts;

    @Autowired
    public QuotaManager(AdmissionProperties properties, QuotaCounterStore store, Clock clock) {
        this(properties.getQuota().getProvider(), properties.getQuota().toAllocation(), store, clock,
                properties.getQuota().getMaxCasAttempts());
    }

    public QuotaManager(String provider, QuotaAllocation baseAllocation, QuotaCounterStore store, Clock clock, int maxCasAttempts) {
        if (maxCasAttempts < 1) {
            throw new IllegalArgumentException("maxCasAttempts < 1");
        }
        this.provider = provider;
        this.baseAllocation = baseAllocation;
        this.store = store;
        this.clock = clock;
        this.maxCasAttempts = maxCasAttempts;
    }

    public boolean requestQuota(String environment) {
        return requestQuota(environment, 1);
    }

    public boolean requestQuota(String environment, long amount) {
        return tryRequestQuota(environment, amount).isApproved();
    }

    /**
     * Evaluates and, when approved, records a request for {@code amount} units on behalf of {@code environment}.
     */
    public QuotaResult tryRequestQuota(String environment, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount <= 0");
        }
        QuotaKeys keys = keysFor(environment);
        QuotaAllocation allocation = baseAllocation;
        try {
            allocation = effectiveAllocation(keys);
            for (int attempt = 1; attempt <= maxCasAttempts; attempt++) {
                QuotaUsageSnapshot usage = store.read(keys);
                QuotaDecision decision = QuotaPolicy.evaluate(allocation, usage, environment, amount);
                if (!decision.isApproved()) {
                    QuotaResult denied = result(decision, allocation, usage, environment, amount, 0);
                    log.info("Quota denied: {}", denied);
                    return denied;
                }
                if (store.compareAndIncrement(keys, usage, environment, amount)) {
                    QuotaResult approved = result(decision, allocation, usage, environment, amount, amount);
                    if (decision == QuotaDecision.APPROVED_SPILLOVER) {
                        log.info("Quota approved from spillover: {}", approved);
                    } else {
                        log.debug("Quota approved: {}", approved);
                    }
                    return approved;
                }
                log.debug("Quota counters for {} changed concurrently, re-evaluating (attempt {})", environment, attempt);
            }
            QuotaUsageSnapshot last = store.read(keys);
            log.warn("Quota request for {} lost {} compare-and-increment rounds, denying", environment, maxCasAttempts);
            return result(QuotaDecision.DENIED_CONTENTION, allocation, last, environment, amount, 0);
        } catch (RedisConnectionFailureException ex) {
            log.warn("Quota store connection failure for provider {} environment {}; denying request", provider, environment, ex);
            return QuotaResult.storeFailure(environment, amount, allocation.allocatedTo(environment), allocation.getTotalDailyLimit());
        } catch (DataAccessException ex) {
            log.error("Quota store error for provider {} environment {}; denying request", provider, environment, ex);
            return QuotaResult.storeFailure(environment, amount, allocation.allocatedTo(environment), allocation.getTotalDailyLimit());
        } catch (RuntimeException ex) {
            // never let admission crash the worker; deny instead
            log.error("Unexpected quota error for provider {} environment {}; denying request", provider, environment, ex);
            return QuotaResult.storeFailure(environment, amount, allocation.allocatedTo(environment), allocation.getTotalDailyLimit());
        }
    }

    public EnvironmentQuotaStatus getUsageStatus(String environment) {
        QuotaKeys keys = keysFor(environment);
        return withStore(() -> {
            QuotaAllocation allocation = effectiveAllocation(keys);
            QuotaUsageSnapshot usage = store.read(keys);
            return status(allocation, usage, environment);
        });
    }

    public GlobalQuotaStatus getGlobalStatus() {
        QuotaKeys keys = keysFor(null);
        return withStore(() -> new GlobalQuotaStatus(baseAllocation.getTotalDailyLimit(), store.read(keys).getGlobalUsed()));
    }

    /**
     * Global and per-environment status for every allocated environment.
     */
    public QuotaStatusReport getStatusReport() {
        QuotaKeys keys = keysFor(null);
        return withStore(() -> {
            QuotaAllocation allocation = effectiveAllocation(keys);
            QuotaUsageSnapshot usage = store.read(keys);
            List<EnvironmentQuotaStatus> environments = new ArrayList<>();
            for (String env : keys.getEnvironments()) {
                environments.add(status(allocation, usage, env));
            }
            return new QuotaStatusReport(provider, keys.getDay(),
                    new GlobalQuotaStatus(allocation.getTotalDailyLimit(), usage.getGlobalUsed()), environments);
        });
    }

    /**
     * Overrides {@code environment}'s allocation for the rest of today.
     *
     * @throws IllegalArgumentException if the resulting table would exceed the total daily limit
     */
    public EnvironmentQuotaStatus allocate(String environment, long allocated) {
        QuotaKeys keys = keysFor(environment);
        return withStore(() -> {
            QuotaAllocation updated = effectiveAllocation(keys).withAllocation(environment, allocated);
            store.writeAllocationOverride(keys, environment, allocated);
            log.info("Allocation for {} set to {} on {} (provider {})", environment, allocated, keys.getDay(), provider);
            return status(updated, store.read(keys), environment);
        });
    }

    /**
     * Operator reset of today's usage; {@code null} resets every environment and the global counter.
     */
    public void reset(String environment) {
        QuotaKeys keys = keysFor(environment);
        withStore(() -> {
            store.reset(keys, environment);
            return null;
        });
        log.warn("Quota usage reset for provider {} on {} (environment={})", provider, keys.getDay(),
                environment == null ? "all" : environment);
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    public String getProvider() {
        return provider;
    }

    public boolean isDistributed() {
        return store.isDistributed();
    }

    private QuotaKeys keysFor(String environment) {
        Set<String> environments = new LinkedHashSet<>(baseAllocation.environmentNames());
        if (environment != null) {
            if (QuotaAllocation.GLOBAL_SCOPE.equals(environment)) {
                throw new IllegalArgumentException("'" + QuotaAllocation.GLOBAL_SCOPE + "' is not an environment");
            }
            environments.add(environment);
        }
        return new QuotaKeys(provider, today(), environments);
    }

    private QuotaAllocation effectiveAllocation(QuotaKeys keys) {
        Map<String, Long> overrides = store.readAllocationOverrides(keys);
        if (overrides.isEmpty()) {
            return baseAllocation;
        }
        Map<String, EnvironmentAllocation> table = new LinkedHashMap<>(baseAllocation.getEnvironments());
        for (Map.Entry<String, Long> override : overrides.entrySet()) {
            EnvironmentAllocation current = table.get(override.getKey());
            int priority = current != null ? current.getPriority() : lowestPriority(table) + 1;
            table.put(override.getKey(), new EnvironmentAllocation(override.getValue(), priority));
        }
        try {
            return new QuotaAllocation(baseAllocation.getTotalDailyLimit(), table);
        } catch (IllegalArgumentException ex) {
            log.warn("Allocation overrides for {} do not fit together ({}); applying them one by one",
                    keys.getDay(), ex.getMessage());
        }
        QuotaAllocation allocation = baseAllocation;
        for (Map.Entry<String, Long> override : overrides.entrySet()) {
            try {
                allocation = allocation.withAllocation(override.getKey(), override.getValue());
            } catch (IllegalArgumentException ex) {
                log.warn("Ignoring allocation override {}={} for {}: {}", override.getKey(), override.getValue(),
                        keys.getDay(), ex.getMessage());
            }
        }
        return allocation;
    }

    private static int lowestPriority(Map<String, EnvironmentAllocation> table) {
        int lowest = 0;
        for (EnvironmentAllocation allocation : table.values()) {
            lowest = Math.max(lowest, allocation.getPriority());
        }
        return lowest;
    }

    private static EnvironmentQuotaStatus status(QuotaAllocation allocation, QuotaUsageSnapshot usage, String environment) {
        return new EnvironmentQuotaStatus(environment, allocation.allocatedTo(environment), usage.usedBy(environment),
                allocation.priorityOf(environment));
    }

    private static QuotaResult result(QuotaDecision decision, QuotaAllocation allocation, QuotaUsageSnapshot usage,
                                      String environment, long amount, long added) {
        return new QuotaResult(decision, environment, amount,
                usage.usedBy(environment) + added, allocation.allocatedTo(environment),
                usage.getGlobalUsed() + added, allocation.getTotalDailyLimit());
    }

    private <T> T withStore(StoreCall<T> call) {
        try {
            return call.run();
        } catch (DataAccessException ex) {
            log.error("Quota store unavailable for provider {}", provider, ex);
            throw new AdmissionException("QUOTA_STORE_UNAVAILABLE", "Quota counters for " + provider + " are unavailable", ex)
                    .addContext("provider", provider);
        }
    }

    @FunctionalInterface
    private interface StoreCall<T> {
        T run();
    }
}
