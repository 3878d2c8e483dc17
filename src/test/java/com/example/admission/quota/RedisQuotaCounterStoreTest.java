package com.example.admission.quota;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisQuotaCounterStoreTest {

    private static final String GLOBAL = "barchart:quota:20240301:global:used";
    private static final String PROD = "barchart:quota:20240301:prod:used";
    private static final String TEST = "barchart:quota:20240301:test:used";

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private RedisScript<Long> casScript;
    private RedisScript<Long> resetScript;
    private RedisQuotaCounterStore store;
    private QuotaKeys keys;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        casScript = mock(RedisScript.class);
        resetScript = mock(RedisScript.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        store = new RedisQuotaCounterStore(redisTemplate, casScript, resetScript, Duration.ofHours(24));
        keys = new QuotaKeys("barchart", LocalDate.of(2024, 3, 1), new LinkedHashSet<>(List.of("prod", "test")));
    }

    @Test
    void readParsesCountersAndTreatsMissingAsZero() {
        when(valueOps.multiGet(List.of(GLOBAL, PROD, TEST))).thenReturn(Arrays.asList("7", null, "7"));

        QuotaUsageSnapshot snapshot = store.read(keys);

        assertEquals(7, snapshot.getGlobalUsed());
        assertEquals(0, snapshot.usedBy("prod"));
        assertEquals(7, snapshot.usedBy("test"));
    }

    @Test
    void compareAndIncrementPassesExpectedValuesToScript() {
        Map<String, Long> used = new LinkedHashMap<>();
        used.put("prod", 3L);
        used.put("test", 1L);
        QuotaUsageSnapshot expected = new QuotaUsageSnapshot(4, used);
        when(redisTemplate.execute(casScript, List.of(GLOBAL, PROD, TEST), "4", "3", "1", "3", "2", "86400"))
                .thenReturn(1L);

        assertTrue(store.compareAndIncrement(keys, expected, "test", 2));
        verify(redisTemplate).execute(eq(casScript), eq(List.of(GLOBAL, PROD, TEST)),
                eq("4"), eq("3"), eq("1"), eq("3"), eq("2"), eq("86400"));
    }

    @Test
    void conflictOrMissingScriptResultIsNotAdmitted() {
        QuotaUsageSnapshot expected = new QuotaUsageSnapshot(0, Map.of());
        when(redisTemplate.execute(casScript, List.of(GLOBAL, PROD, TEST), "0", "0", "0", "2", "1", "86400"))
                .thenReturn(0L);
        assertFalse(store.compareAndIncrement(keys, expected, "prod", 1));

        when(redisTemplate.execute(casScript, List.of(GLOBAL, PROD, TEST), "0", "0", "0", "2", "1", "86400"))
                .thenReturn(null);
        assertFalse(store.compareAndIncrement(keys, expected, "prod", 1));
    }

    @Test
    void environmentOutsideKeysIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> store.compareAndIncrement(keys, new QuotaUsageSnapshot(0, Map.of()), "dev", 1));
    }

    @Test
    @SuppressWarnings("unchecked")
    void resetAllDeletesEveryUsageCounterOfTheDay() {
        String staging = "barchart:quota:20240301:staging:used";
        Cursor<String> cursor = mock(Cursor.class);
        when(cursor.hasNext()).thenReturn(true, true, false);
        when(cursor.next()).thenReturn(GLOBAL, staging);
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);

        store.reset(keys, null);

        verify(redisTemplate).delete(new LinkedHashSet<>(List.of(GLOBAL, PROD, TEST, staging)));
        verify(cursor).close();
    }

    @Test
    void resetEnvironmentRunsScript() {
        when(redisTemplate.execute(resetScript, List.of(GLOBAL, PROD))).thenReturn(5L);
        store.reset(keys, "prod");
        verify(redisTemplate).execute(resetScript, List.of(GLOBAL, PROD));
    }

    @Test
    void allocationOverridesUseExpiringKeys() {
        store.writeAllocationOverride(keys, "test", 40);
        verify(valueOps).set("barchart:quota:20240301:test:allocation", "40", Duration.ofHours(24));

        when(valueOps.multiGet(anyList())).thenReturn(Arrays.asList(null, "40"));
        assertEquals(Map.of("test", 40L), store.readAllocationOverrides(keys));
        assertTrue(store.isDistributed());
    }
}
