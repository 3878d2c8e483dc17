package com.example.admission.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Snapshot of every environment's quota position for one provider and UTC day.
 */
public class QuotaStatusReport {

    private final String provider;
    private final LocalDate day;
    private final GlobalQuotaStatus global;
    private final List<EnvironmentQuotaStatus> environments;

    public QuotaStatusReport(String provider, LocalDate day, GlobalQuotaStatus global, List<EnvironmentQuotaStatus> environments) {
        this.provider = provider;
        this.day = day;
        this.global = global;
        this.environments = List.copyOf(environments);
    }

    public String getProvider() {
        return provider;
    }

    public LocalDate getDay() {
        return day;
    }

    public GlobalQuotaStatus getGlobal() {
        return global;
    }

    public List<EnvironmentQuotaStatus> getEnvironments() {
        return environments;
    }
}
