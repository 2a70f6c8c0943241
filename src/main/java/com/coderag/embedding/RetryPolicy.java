package com.coderag.embedding;

import java.time.Duration;
import java.util.Set;

public record RetryPolicy(int maxAttempts, Duration baseDelay) {
    static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        baseDelay = baseDelay == null ? Duration.ZERO : baseDelay;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1));
    }

    boolean isRetryable(int statusCode) {
        return RETRYABLE_STATUSES.contains(statusCode);
    }

    Duration delayBeforeRetry(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(attempt, 16));
    }
}
