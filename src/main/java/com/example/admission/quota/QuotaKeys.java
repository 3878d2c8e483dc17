package com.example.admission.quota;

import com.example.admission.model.QuotaAllocation;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Counter key layout for one provider and UTC day:
 * <pre>
 * {provider}:quota:{YYYYMMDD}:{environment}:used
 * {provider}:quota:{YYYYMMDD}:global:used
 * {provider}:quota:{YYYYMMDD}:{environment}:allocation
 * </pre>
 */
public final class QuotaKeys {

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private final String provider;
    private final LocalDate day;
    private final List<String> environments;

    public QuotaKeys(String provider, LocalDate day, Set<String> environments) {
        this.provider = provider;
        this.day = day;
        this.environments = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(environments)));
    }

    static final String USED_SUFFIX = ":used";

    /**
     * Common prefix of every key of this provider and day.
     */
    public String dayPrefix() {
        return provider + ":quota:" + DAY.format(day) + ":";
    }

    /**
     * Glob matching every usage counter of this provider and day, global included.
     */
    public String usedKeyPattern() {
        return dayPrefix() + "*" + USED_SUFFIX;
    }

    public boolean isUsedKeyOfDay(String key) {
        return key.startsWith(dayPrefix()) && key.endsWith(USED_SUFFIX);
    }

    public String usedKey(String environment) {
        return dayPrefix() + environment + USED_SUFFIX;
    }

    public String globalKey() {
        return dayPrefix() + QuotaAllocation.GLOBAL_SCOPE + USED_SUFFIX;
    }

    public String allocationKey(String environment) {
        return dayPrefix() + environment + ":allocation";
    }

    public String getProvider() {
        return provider;
    }

    public LocalDate getDay() {
        return day;
    }

    /**
     * Environments whose counters are read together; covers the allocation table plus the requester.
     */
    public List<String> getEnvironments() {
        return environments;
    }
}
