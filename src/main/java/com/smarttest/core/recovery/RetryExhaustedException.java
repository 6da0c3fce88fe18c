package com.smarttest.core.recovery;

/**
 * Thrown when every attempt of a retried operation failed. The cause is the last failure.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("Operation failed after " + attempts + " attempt(s): " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
