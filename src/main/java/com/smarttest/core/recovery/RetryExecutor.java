package com.smarttest.core.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Runs an operation with exponential backoff, without classifying failures.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Sleeper sleeper;

    public RetryExecutor() {
        this(Sleeper.SYSTEM);
    }

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Calls {@code operation} until it succeeds or {@code options.maxAttempts()} attempts have failed.
     *
     * @throws RetryExhaustedException carrying the last failure when every attempt failed
     */
    public <T> T withRetry(Callable<T> operation, RetryOptions options) {
        Exception lastError = null;
        for (int attempt = 1; attempt <= options.maxAttempts(); attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                lastError = e;
                if (attempt < options.maxAttempts()) {
                    Duration delay = delayFor(attempt, options);
                    log.debug("Attempt {} failed ({}), retrying in {} ms", attempt, e.getMessage(), delay.toMillis());
                    if (options.onRetry() != null) {
                        options.onRetry().accept(e, attempt);
                    }
                    pause(delay, attempt, e);
                }
            }
        }
        throw new RetryExhaustedException(options.maxAttempts(), lastError);
    }

    static Duration delayFor(int failedAttempt, RetryOptions options) {
        long base = options.baseDelay().toMillis();
        long raw = base * (1L << Math.min(failedAttempt - 1, 30));
        return Duration.ofMillis(Math.min(raw, options.maxDelay().toMillis()));
    }

    private void pause(Duration delay, int attempts, Exception lastError) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            var interrupted = new RetryExhaustedException(attempts, lastError);
            interrupted.addSuppressed(ie);
            throw interrupted;
        }
    }
}
