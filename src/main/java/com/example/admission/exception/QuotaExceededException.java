package com.example.admission.exception;

import com.example.admission.model.QuotaResult;

/**
 * Raised when the shared daily quota denies a request, either at the environment
 * allocation or at the global ceiling.
 */
public class QuotaExceededException extends AdmissionException {

    private final QuotaResult result;

    public QuotaExceededException(String provider, QuotaResult result) {
        super("QUOTA_EXCEEDED", describe(provider, result));
        this.result = result;
        addContext("provider", provider);
        addContext("environment", result.getEnvironment());
        addContext("decision", result.getDecision());
        addContext("environmentUsed", result.getEnvironmentUsed());
        addContext("allocated", result.getAllocated());
        addContext("globalUsed", result.getGlobalUsed());
        addContext("globalLimit", result.getGlobalLimit());
        addContext("spilloverConsidered", result.isSpilloverConsidered());
    }

    private static String describe(String provider, QuotaResult result) {
        return String.format("Daily quota for %s denied %d unit(s) to environment %s (%s): environment %d/%d, global %d/%d",
                provider, result.getAmount(), result.getEnvironment(), result.getDecision(),
                result.getEnvironmentUsed(), result.getAllocated(), result.getGlobalUsed(), result.getGlobalLimit());
    }

    public QuotaResult getResult() {
        return result;
    }

    public String getEnvironment() {
        return result.getEnvironment();
    }

    public boolean isSpilloverConsidered() {
        return result.isSpilloverConsidered();
    }
}
