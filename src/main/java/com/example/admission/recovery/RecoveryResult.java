package com.example.admission.recovery;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one recovery run. {@code attemptedStrategies} lists every strategy tried, in order,
 * including the terminal MANUAL_INTERVENTION on failure.
 */
public class RecoveryResult<T> {

    private final boolean success;
    private final RecoveryStrategy strategyUsed;
    private final List<RecoveryStrategy> attemptedStrategies;
    private final List<String> attemptedActions;
    private final T value;
    private final Throwable finalError;
    private final Duration elapsed;

    private RecoveryResult(boolean success, RecoveryStrategy strategyUsed, List<RecoveryStrategy> attemptedStrategies,
                           List<String> attemptedActions, T value, Throwable finalError, Duration elapsed) {
        this.success = success;
        this.strategyUsed = strategyUsed;
        this.attemptedStrategies = List.copyOf(attemptedStrategies);
        this.attemptedActions = List.copyOf(attemptedActions);
        this.value = value;
        this.finalError = finalError;
        this.elapsed = elapsed;
    }

    static <T> RecoveryResult<T> recovered(RecoveryStrategy strategy, List<RecoveryStrategy> attempted,
                                           List<String> actions, T value, Duration elapsed) {
        return new RecoveryResult<>(true, strategy, attempted, actions, value, null, elapsed);
    }

    static <T> RecoveryResult<T> failed(List<RecoveryStrategy> attempted, List<String> actions,
                                        Throwable finalError, Duration elapsed) {
        return new RecoveryResult<>(false, RecoveryStrategy.MANUAL_INTERVENTION, attempted, actions, null, finalError, elapsed);
    }

    public boolean isSuccess() {
        return success;
    }

    public RecoveryStrategy getStrategyUsed() {
        return strategyUsed;
    }

    public List<RecoveryStrategy> getAttemptedStrategies() {
        return attemptedStrategies;
    }

    /**
     * Human-readable form of each attempted action, e.g. {@code PROVIDER_FALLBACK(yahoo)}.
     */
    public List<String> getAttemptedActions() {
        return attemptedActions;
    }

    public T getValue() {
        return value;
    }

    public Optional<Throwable> getFinalError() {
        return Optional.ofNullable(finalError);
    }

    public Duration getElapsed() {
        return elapsed;
    }
}
