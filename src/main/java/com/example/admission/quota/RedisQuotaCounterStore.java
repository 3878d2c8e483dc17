package com.example.admission.quota;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counter store backed by Redis, shared by every environment, process and host.
 * <p>
 * The conditional increment runs as a Lua script, so Redis applies the compare and both
 * increments as one step. Reads are plain MGETs; the script re-validates them.
 * Redis errors propagate as Spring {@code DataAccessException}s for the caller to handle.
 */
public class RedisQuotaCounterStore implements QuotaCounterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisQuotaCounterStore.class);

    private static final long SCAN_BATCH = 100;

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> compareAndIncrementScript;
    private final RedisScript<Long> resetEnvironmentScript;
    private final Duration keyTtl;

    public RedisQuotaCounterStore(
            StringRedisTemplate redisTemplate,
            RedisScript<Long> compareAndIncrementScript,
            RedisScript<Long> resetEnvironmentScript,
            Duration keyTtl
    ) {
        this.redisTemplate = redisTemplate;
        this.compareAndIncrementScript = compareAndIncrementScript;
        this.resetEnvironmentScript = resetEnvironmentScript;
        this.keyTtl = keyTtl;
    }

    @Override
    public QuotaUsageSnapshot read(QuotaKeys keys) {
        List<String> redisKeys = counterKeys(keys);
        List<String> values = redisTemplate.opsForValue().multiGet(redisKeys);
        long global = parse(values, 0);
        Map<String, Long> used = new LinkedHashMap<>();
        List<String> environments = keys.getEnvironments();
        for (int i = 0; i < environments.size(); i++) {
            used.put(environments.get(i), parse(values, i + 1));
        }
        return new QuotaUsageSnapshot(global, used);
    }

    @Override
    public boolean compareAndIncrement(QuotaKeys keys, QuotaUsageSnapshot expected, String environment, long amount) {
        List<String> environments = keys.getEnvironments();
        int target = environments.indexOf(environment);
        if (target < 0) {
            throw new IllegalArgumentException("Environment " + environment + " is not covered by the quota keys");
        }

        List<String> args = new ArrayList<>(environments.size() + 4);
        args.add(Long.toString(expected.getGlobalUsed()));
        for (String env : environments) {
            args.add(Long.toString(expected.usedBy(env)));
        }
        // KEYS[1] is the global counter, so the environment's key index is shifted by one (Lua is 1-based)
        args.add(Integer.toString(target + 2));
        args.add(Long.toString(amount));
        args.add(Long.toString(keyTtl.getSeconds()));

        Long applied = redisTemplate.execute(compareAndIncrementScript, counterKeys(keys), args.toArray());
        if (applied == null) {
            // pipelined/transactional templates return null; never count that as admitted
            log.error("Quota compare-and-increment returned no result for {}", keys.usedKey(environment));
            return false;
        }
        return applied == 1L;
    }

    @Override
    public void reset(QuotaKeys keys, String environment) {
        if (environment == null) {
            Set<String> usedKeys = new LinkedHashSet<>(counterKeys(keys));
            // counters of environments outside the allocation table are cleared too
            try (Cursor<String> cursor = redisTemplate.scan(
                    ScanOptions.scanOptions().match(keys.usedKeyPattern()).count(SCAN_BATCH).build())) {
                while (cursor.hasNext()) {
                    usedKeys.add(cursor.next());
                }
            }
            Long deleted = redisTemplate.delete(usedKeys);
            log.info("Deleted {} quota counter key(s) for {} on {}", deleted, keys.getProvider(), keys.getDay());
            return;
        }
        Long cleared = redisTemplate.execute(resetEnvironmentScript,
                List.of(keys.globalKey(), keys.usedKey(environment)));
        log.info("Cleared {} unit(s) of usage for environment {} on {}", cleared, environment, keys.getDay());
    }

    @Override
    public Map<String, Long> readAllocationOverrides(QuotaKeys keys) {
        List<String> environments = keys.getEnvironments();
        List<String> redisKeys = new ArrayList<>(environments.size());
        for (String env : environments) {
            redisKeys.add(keys.allocationKey(env));
        }
        List<String> values = redisTemplate.opsForValue().multiGet(redisKeys);
        Map<String, Long> overrides = new LinkedHashMap<>();
        for (int i = 0; i < environments.size(); i++) {
            String raw = values == null ? null : values.get(i);
            if (raw != null) {
                overrides.put(environments.get(i), Long.parseLong(raw));
            }
        }
        return overrides;
    }

    @Override
    public void writeAllocationOverride(QuotaKeys keys, String environment, long allocated) {
        redisTemplate.opsForValue().set(keys.allocationKey(environment), Long.toString(allocated), keyTtl);
    }

    @Override
    public boolean isDistributed() {
        return true;
    }

    private static List<String> counterKeys(QuotaKeys keys) {
        List<String> redisKeys = new ArrayList<>(keys.getEnvironments().size() + 1);
        redisKeys.add(keys.globalKey());
        for (String env : keys.getEnvironments()) {
            redisKeys.add(keys.usedKey(env));
        }
        return redisKeys;
    }

    private static long parse(List<String> values, int index) {
        if (values == null || values.get(index) == null) {
            return 0L;
        }
        return Long.parseLong(values.get(index));
    }
}
