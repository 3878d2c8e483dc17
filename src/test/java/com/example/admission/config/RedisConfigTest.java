package com.example.admission.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.admission.quota.InMemoryQuotaCounterStore;
import com.example.admission.quota.QuotaCounterStore;
import com.example.admission.quota.QuotaManager;
import com.example.admission.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class RedisConfigTest {

    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Logger root;

    @BeforeEach
    void setUp() {
        root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        appender.start();
        root.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        root.detachAppender(appender);
    }

    @Test
    void inMemoryStoreIsWarnedAboutOnce() {
        AdmissionProperties properties = new AdmissionProperties();
        properties.getQuota().setStore(AdmissionProperties.StoreType.IN_MEMORY);
        properties.getQuota().getAllocations().put("prod", new AdmissionProperties.Allocation(200, 1));
        MutableClock clock = MutableClock.at("2024-03-01T10:00:00Z");
        RedisConfig config = new RedisConfig();

        QuotaCounterStore store = config.quotaCounterStore(properties, mock(StringRedisTemplate.class),
                config.quotaCompareAndIncrementScript(), config.quotaResetEnvironmentScript(), clock);
        QuotaManager manager = new QuotaManager(properties, store, clock);

        assertInstanceOf(InMemoryQuotaCounterStore.class, store);
        assertFalse(manager.isDistributed());
        long warnings = appender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .filter(event -> event.getFormattedMessage().contains("in-memory"))
                .count();
        assertEquals(1, warnings);
    }
}
