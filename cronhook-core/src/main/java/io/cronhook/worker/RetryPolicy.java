package io.cronhook.worker;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry rule for failed deliveries: attempts {@code 0..maxRetries}, with an exponential delay of
 * {@code baseDelay * 2^attempt} before the next one (2s, 4s, 8s by default).
 */
public record RetryPolicy(int maxRetries, Duration baseDelay) {

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(2));
    }

    public boolean shouldRetry(int attempt) {
        return attempt < maxRetries;
    }

    /**
     * Delay before the attempt following {@code attempt}.
     */
    public Duration delayAfter(int attempt) {
        int exp = Math.max(0, Math.min(attempt, 20)); // avoid overflow
        return baseDelay.multipliedBy(1L << exp);
    }
}
