package com.smarttest.core.recovery;

import java.time.Duration;
import java.util.function.BiConsumer;

/**
 * @param maxAttempts total attempts including the first
 * @param baseDelay   wait after the first failure; doubles each retry
 * @param maxDelay    upper bound for any single wait
 * @param onRetry     notified with the failure and the 1-based attempt that failed; may be null
 */
public record RetryOptions(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    BiConsumer<Exception, Integer> onRetry
) {

    public RetryOptions {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static RetryOptions defaults() {
        return new RetryOptions(3, Duration.ofSeconds(1), Duration.ofSeconds(30), null);
    }

    public RetryOptions withOnRetry(BiConsumer<Exception, Integer> callback) {
        return new RetryOptions(maxAttempts, baseDelay, maxDelay, callback);
    }
}
