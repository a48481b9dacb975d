package com.socialfeed.infrastructure.resilience;

/**
 * Retry budget for one guarded operation. {@code hasFallback} distinguishes a null fallback value from none.
 */
public record AttemptOptions<T>(
    String operation,
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    boolean jitter,
    boolean hasFallback,
    T fallbackValue
) {
    public AttemptOptions {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays cannot be negative");
        }
    }

    public static <T> AttemptOptions<T> of(String operation, int maxAttempts, long baseDelayMs) {
        return new AttemptOptions<>(operation, maxAttempts, baseDelayMs, Long.MAX_VALUE, false, false, null);
    }

    public AttemptOptions<T> withFallback(T value) {
        return new AttemptOptions<>(operation, maxAttempts, baseDelayMs, maxDelayMs, jitter, true, value);
    }

    public AttemptOptions<T> withMaxDelay(long maxDelayMs) {
        return new AttemptOptions<>(operation, maxAttempts, baseDelayMs, maxDelayMs, jitter, hasFallback, fallbackValue);
    }

    public AttemptOptions<T> withJitter(boolean jitter) {
        return new AttemptOptions<>(operation, maxAttempts, baseDelayMs, maxDelayMs, jitter, hasFallback, fallbackValue);
    }

    /**
     * {@code min(base * 2^(attempt-1), maxDelay)} for a 1-based attempt number.
     */
    public long backoffFor(int attempt) {
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        long delay = baseDelayMs * (1L << exponent);
        if (delay < 0 || delay > maxDelayMs) {
            return maxDelayMs;
        }
        return delay;
    }
}
