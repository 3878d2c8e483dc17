package com.example.admission.recovery;

import com.example.admission.config.AdmissionProperties;
import com.example.admission.exception.FailureReason;
import com.example.admission.exception.ProviderException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fallback providers first (configured order), then degraded operation, then manual intervention.
 * Rejected credentials skip straight to manual intervention.
 */
@Component
public class ProviderRecoveryPolicy implements RecoveryPolicy {

    private final AdmissionProperties properties;

    public ProviderRecoveryPolicy(AdmissionProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<RecoveryAction> analyze(Throwable failure, RecoveryContext<?> context) {
        List<RecoveryAction> actions = new ArrayList<>();
        if (rootProviderFailure(failure) == FailureReason.AUTHENTICATION) {
            actions.add(RecoveryAction.manualIntervention("Invalid credentials for " + context.getProvider() + " require operator action"));
            return actions;
        }
        for (String fallback : properties.getRecovery().fallbacksFor(context.getProvider())) {
            if (!fallback.equals(context.getProvider())) {
                actions.add(RecoveryAction.fallback(fallback, "Primary provider " + context.getProvider() + " failed"));
            }
        }
        if (context.hasDegradedOperation()) {
            actions.add(RecoveryAction.degrade("All providers failed, serving degraded result"));
        }
        actions.add(RecoveryAction.manualIntervention("No automatic recovery left"));
        return actions;
    }

    private static FailureReason rootProviderFailure(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ProviderException provider) {
                return provider.getReason();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }
}
