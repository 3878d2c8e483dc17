package com.example.admission.recovery;

/**
 * A provider request parameterised by provider identity, so it can be replayed against a fallback.
 */
@FunctionalInterface
public interface ProviderCall<T> {

    T call(String provider) throws Exception;
}
