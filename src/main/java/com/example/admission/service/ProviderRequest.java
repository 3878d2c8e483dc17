package com.example.admission.service;

import com.example.admission.recovery.ProviderCall;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * One logical outbound request: what to call, against which provider, and how to degrade.
 */
public final class ProviderRequest<T> {

    private final String operationName;
    private final String provider;
    private final String environment;
    private final ProviderCall<T> call;
    private final Callable<T> degraded;
    private final long quotaCost;
    private final String correlationId;
    private final Map<String, Object> metadata;

    private ProviderRequest(Builder<T> builder) {
        this.operationName = Objects.requireNonNull(builder.operationName, "operationName");
        this.provider = Objects.requireNonNull(builder.provider, "provider");
        this.call = Objects.requireNonNull(builder.call, "call");
        this.environment = builder.environment;
        this.degraded = builder.degraded;
        this.quotaCost = builder.quotaCost;
        this.correlationId = builder.correlationId;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        if (quotaCost < 1) {
            throw new IllegalArgumentException("quotaCost < 1");
        }
    }

    public static <T> Builder<T> builder(String operationName, String provider, ProviderCall<T> call) {
        return new Builder<T>().operationName(operationName).provider(provider).call(call);
    }

    public String getOperationName() {
        return operationName;
    }

    public String getProvider() {
        return provider;
    }

    /**
     * Null means the deployment's configured environment.
     */
    public String getEnvironment() {
        return environment;
    }

    public ProviderCall<T> getCall() {
        return call;
    }

    public Callable<T> getDegraded() {
        return degraded;
    }

    public long getQuotaCost() {
        return quotaCost;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public static final class Builder<T> {
        private String operationName;
        private String provider;
        private String environment;
        private ProviderCall<T> call;
        private Callable<T> degraded;
        private long quotaCost = 1;
        private String correlationId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder<T> operationName(String operationName) {
            this.operationName = operationName;
            return this;
        }

        public Builder<T> provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder<T> environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder<T> call(ProviderCall<T> call) {
            this.call = call;
            return this;
        }

        public Builder<T> degraded(Callable<T> degraded) {
            this.degraded = degraded;
            return this;
        }

        public Builder<T> quotaCost(long quotaCost) {
            this.quotaCost = quotaCost;
            return this;
        }

        public Builder<T> correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder<T> metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public ProviderRequest<T> build() {
            return new ProviderRequest<>(this);
        }
    }
}
