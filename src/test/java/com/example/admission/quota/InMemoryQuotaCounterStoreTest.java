package com.example.admission.quota;

import com.example.admission.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryQuotaCounterStoreTest {

    private MutableClock clock;
    private InMemoryQuotaCounterStore store;
    private QuotaKeys keys;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        store = new InMemoryQuotaCounterStore(clock, Duration.ofHours(24));
        keys = new QuotaKeys("barchart", LocalDate.of(2024, 3, 1), Set.of("prod", "test"));
    }

    @Test
    void missingCountersReadAsZero() {
        QuotaUsageSnapshot snapshot = store.read(keys);
        assertEquals(0, snapshot.getGlobalUsed());
        assertEquals(0, snapshot.usedBy("prod"));
    }

    @Test
    void compareAndIncrementRequiresUnchangedCounters() {
        QuotaUsageSnapshot before = store.read(keys);
        assertTrue(store.compareAndIncrement(keys, before, "test", 3));

        // stale expectation
        assertFalse(store.compareAndIncrement(keys, before, "prod", 1));

        QuotaUsageSnapshot after = store.read(keys);
        assertEquals(3, after.getGlobalUsed());
        assertEquals(3, after.usedBy("test"));
        assertEquals(0, after.usedBy("prod"));
    }

    @Test
    void countersExpireAfterTtl() {
        store.compareAndIncrement(keys, store.read(keys), "prod", 5);
        clock.advance(Duration.ofHours(23));
        assertEquals(5, store.read(keys).getGlobalUsed());

        clock.advance(Duration.ofHours(1));
        assertEquals(0, store.read(keys).getGlobalUsed());
    }

    @Test
    void resetEnvironmentSubtractsFromGlobal() {
        store.compareAndIncrement(keys, store.read(keys), "prod", 5);
        store.compareAndIncrement(keys, store.read(keys), "test", 2);

        store.reset(keys, "prod");

        QuotaUsageSnapshot snapshot = store.read(keys);
        assertEquals(2, snapshot.getGlobalUsed());
        assertEquals(0, snapshot.usedBy("prod"));
    }

    @Test
    void resetAllClearsCountersOutsideTheKeySet() {
        QuotaKeys withStaging = new QuotaKeys("barchart", LocalDate.of(2024, 3, 1), Set.of("prod", "test", "staging"));
        store.compareAndIncrement(withStaging, store.read(withStaging), "staging", 4);
        store.compareAndIncrement(keys, store.read(keys), "prod", 5);
        store.writeAllocationOverride(keys, "test", 40);

        store.reset(keys, null);

        QuotaUsageSnapshot snapshot = store.read(withStaging);
        assertEquals(0, snapshot.getGlobalUsed());
        assertEquals(0, snapshot.usedBy("staging"));
        assertEquals(0, snapshot.usedBy("prod"));
        // allocation overrides are not usage
        assertEquals(Map.of("test", 40L), store.readAllocationOverrides(keys));
    }

    @Test
    void allocationOverridesAreStoredPerDay() {
        store.writeAllocationOverride(keys, "test", 40);
        assertEquals(Map.of("test", 40L), store.readAllocationOverrides(keys));

        QuotaKeys tomorrow = new QuotaKeys("barchart", LocalDate.of(2024, 3, 2), Set.of("prod", "test"));
        assertTrue(store.readAllocationOverrides(tomorrow).isEmpty());
        assertFalse(store.isDistributed());
    }

    @Test
    void keysFollowDocumentedLayout() {
        assertEquals("barchart:quota:20240301:prod:used", keys.usedKey("prod"));
        assertEquals("barchart:quota:20240301:global:used", keys.globalKey());
        assertEquals("barchart:quota:20240301:test:allocation", keys.allocationKey("test"));
    }
}
