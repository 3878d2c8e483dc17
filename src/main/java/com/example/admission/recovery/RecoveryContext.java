package com.example.admission.recovery;

import com.example.admission.correlation.CorrelationContext;

import java.util.concurrent.Callable;

/**
 * What the recovery manager knows about the failed request.
 */
public final class RecoveryContext<T> {

    private final String operation;
    private final String provider;
    private final String environment;
    private final CorrelationContext correlation;
    private final Callable<T> degradedOperation;

    public RecoveryContext(String operation, String provider, String environment,
                           CorrelationContext correlation, Callable<T> degradedOperation) {
        this.operation = operation;
        this.provider = provider;
        this.environment = environment;
        this.correlation = correlation;
        this.degradedOperation = degradedOperation;
    }

    /**
     * Same request, now addressed to {@code fallbackProvider}.
     */
    public RecoveryContext<T> withProvider(String fallbackProvider) {
        return new RecoveryContext<>(operation, fallbackProvider, environment, correlation, degradedOperation);
    }

    public String getOperation() {
        return operation;
    }

    public String getProvider() {
        return provider;
    }

    public String getEnvironment() {
        return environment;
    }

    /**
     * May be null when recovery runs outside a correlation scope.
     */
    public CorrelationContext getCorrelation() {
        return correlation;
    }

    public Callable<T> getDegradedOperation() {
        return degradedOperation;
    }

    public boolean hasDegradedOperation() {
        return degradedOperation != null;
    }
}
