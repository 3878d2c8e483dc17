package com.example.admission.retry;

/**
 * Backoff shape between attempts. {@code attempt} is 1-indexed: the delay after the first failure uses attempt 1.
 */
public enum RetryStrategy {
    FIXED_DELAY {
        @Override
        double multiplier(int attempt) {
            return 1.0;
        }
    },
    LINEAR_BACKOFF {
        @Override
        double multiplier(int attempt) {
            return attempt;
        }
    },
    EXPONENTIAL_BACKOFF {
        @Override
        double multiplier(int attempt) {
            return Math.pow(2.0, attempt - 1);
        }
    },
    EXPONENTIAL_BACKOFF_JITTER {
        @Override
        double multiplier(int attempt) {
            return Math.pow(2.0, attempt - 1);
        }

        @Override
        boolean jittered() {
            return true;
        }
    };

    abstract double multiplier(int attempt);

    boolean jittered() {
        return false;
    }
}
