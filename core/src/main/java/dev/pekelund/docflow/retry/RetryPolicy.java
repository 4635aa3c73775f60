package dev.pekelund.docflow.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter for calls to the AI service and other contended resources.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative");
        }
        if (jitterFactor < 0 || jitterFactor >= 1) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1)");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    public static RetryPolicy of(Duration baseDelay, double jitterFactor, int maxAttempts) {
        return new RetryPolicy(baseDelay.toMillis(), jitterFactor, maxAttempts);
    }

    /**
     * Delay in milliseconds before the attempt following the given one-based failed attempt.
     * Formula: baseDelay * 2^(attempt - 1), then jitter.
     */
    public long delayMs(int failedAttempt) {
        if (failedAttempt <= 1) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(failedAttempt - 1, 20));
        return jitter(exponential);
    }

    private long jitter(long value) {
        if (jitterFactor == 0) {
            return value;
        }
        ThreadLocalRandom random = ThreadLocalRandom.current();
        double jitter = 1.0 + (random.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 2s base, 25% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(2000L, 0.25, 3);
    }
}
