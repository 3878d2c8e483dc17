package com.example.admission.recovery;

import java.util.List;

/**
 * Decides which recovery actions to try, in order, for a failure.
 */
public interface RecoveryPolicy {

    List<RecoveryAction> analyze(Throwable failure, RecoveryContext<?> context);
}
