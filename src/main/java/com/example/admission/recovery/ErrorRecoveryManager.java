package com.example.admission.recovery;

import com.example.admission.exception.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs the recovery plan produced by a {@link RecoveryPolicy} after a provider request failed.
 * <p>
 * Actions are tried in order until one produces a value. Fallback providers are invoked through the
 * supplied {@link ProviderCall}, so they pass through the same admission pipeline as the primary.
 * Cancellation stops the plan immediately and propagates.
 */
@Service
public class ErrorRecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(ErrorRecoveryManager.class);

    private final RecoveryPolicy policy;
    private final Clock clock;
    private final Map<String, RecoveryStatistics> statistics = new HashMap<>();

    public ErrorRecoveryManager(RecoveryPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    public <T> RecoveryResult<T> attemptRecovery(ProviderCall<T> call, Throwable failure, RecoveryContext<T> context) {
        Instant started = clock.instant();
        List<RecoveryAction> plan = policy.analyze(failure, context);
        log.info("Recovering {} after {} from {}: plan {}", context.getOperation(),
                failure.getClass().getSimpleName(), context.getProvider(), plan);

        List<RecoveryStrategy> attempted = new ArrayList<>();
        List<String> actions = new ArrayList<>();
        Throwable lastError = failure;

        for (RecoveryAction action : plan) {
            attempted.add(action.getStrategy());
            actions.add(action.toString());
            switch (action.getStrategy()) {
                case PROVIDER_FALLBACK:
                    try {
                        T value = call.call(action.getFallbackProvider());
                        log.info("Recovered {} using fallback provider {}", context.getOperation(), action.getFallbackProvider());
                        return record(context, RecoveryResult.recovered(action.getStrategy(), attempted, actions, value,
                                elapsedSince(started)));
                    } catch (OperationCancelledException ex) {
                        throw ex;
                    } catch (Exception ex) {
                        if (Thread.currentThread().isInterrupted()) {
                            throw new OperationCancelledException("Recovery of " + context.getOperation() + " interrupted", ex);
                        }
                        log.warn("Fallback provider {} failed for {}: {}", action.getFallbackProvider(),
                                context.getOperation(), ex.toString());
                        lastError = ex;
                    }
                    break;
                case GRACEFUL_DEGRADATION:
                    try {
                        T value = context.getDegradedOperation().call();
                        log.warn("Serving degraded result for {}: {}", context.getOperation(), action.getReason());
                        return record(context, RecoveryResult.recovered(action.getStrategy(), attempted, actions, value,
                                elapsedSince(started)));
                    } catch (OperationCancelledException ex) {
                        throw ex;
                    } catch (Exception ex) {
                        log.warn("Degraded operation failed for {}: {}", context.getOperation(), ex.toString());
                        lastError = ex;
                    }
                    break;
                case MANUAL_INTERVENTION:
                default:
                    log.error("Manual intervention required for {} (environment={}, provider={}): {}",
                            context.getOperation(), context.getEnvironment(), context.getProvider(), action.getReason(),
                            lastError);
                    return record(context, RecoveryResult.failed(attempted, actions, lastError, elapsedSince(started)));
            }
        }
        return record(context, RecoveryResult.failed(attempted, actions, lastError, elapsedSince(started)));
    }

    /**
     * Copies of the per-operation statistics, sorted by operation name.
     */
    public synchronized Map<String, RecoveryStatistics> getStatistics() {
        Map<String, RecoveryStatistics> copy = new TreeMap<>();
        statistics.forEach((operation, stats) -> copy.put(operation, stats.copy()));
        return copy;
    }

    public synchronized void resetStatistics() {
        statistics.clear();
        log.info("Recovery statistics reset");
    }

    private synchronized <T> RecoveryResult<T> record(RecoveryContext<T> context, RecoveryResult<T> result) {
        statistics.computeIfAbsent(context.getOperation(), k -> new RecoveryStatistics()).record(result, clock.instant());
        return result;
    }

    private Duration elapsedSince(Instant started) {
        Duration elapsed = Duration.between(started, clock.instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }
}
