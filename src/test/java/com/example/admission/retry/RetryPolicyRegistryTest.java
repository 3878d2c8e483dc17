package com.example.admission.retry;

import com.example.admission.config.AdmissionProperties;
import com.example.admission.support.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyRegistryTest {

    @Test
    void providerPresetsApply() {
        RetryPolicyRegistry registry = new RetryPolicyRegistry(new AdmissionProperties(), new RecordingSleeper());

        RetryPolicy barchart = registry.policyFor("barchart");
        assertEquals(5, barchart.getMaxAttempts());
        assertEquals(RetryStrategy.EXPONENTIAL_BACKOFF_JITTER, barchart.getStrategy());
        assertEquals(Duration.ofSeconds(120), barchart.getMaxDelay());

        RetryPolicy ibkr = registry.policyFor("ibkr");
        assertEquals(RetryStrategy.LINEAR_BACKOFF, ibkr.getStrategy());
        assertEquals(Duration.ofMillis(1500), ibkr.getBaseDelay());

        assertEquals(3, registry.policyFor("unknown").getMaxAttempts());
    }

    @Test
    void configuredSettingsOverlayPreset() {
        AdmissionProperties properties = new AdmissionProperties();
        AdmissionProperties.RetrySettings yahoo = new AdmissionProperties.RetrySettings();
        yahoo.setMaxAttempts(6);
        properties.getRetry().getProviders().put("yahoo", yahoo);

        RetryPolicy policy = new RetryPolicyRegistry(properties, new RecordingSleeper()).policyFor("yahoo");

        assertEquals(6, policy.getMaxAttempts());
        assertEquals(RetryStrategy.EXPONENTIAL_BACKOFF, policy.getStrategy());
        assertEquals(Duration.ofSeconds(30), policy.getMaxDelay());
    }

    @Test
    void managersAreCachedPerProvider() {
        RetryPolicyRegistry registry = new RetryPolicyRegistry(new AdmissionProperties(), new RecordingSleeper());
        assertSame(registry.managerFor("yahoo"), registry.managerFor("yahoo"));
    }
}
