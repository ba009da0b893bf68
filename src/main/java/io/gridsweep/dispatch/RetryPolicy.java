package io.gridsweep.dispatch;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(baseDelay * 2^attempt + jitter, maxDelay)}
 * with jitter in {@code [0, baseDelay / 10)}. A policy with {@code retries = n}
 * makes at most {@code n + 1} attempts.
 */
public record RetryPolicy(int retries, Duration baseDelay, Duration maxDelay) {
    private static final double JITTER_FRACTION = 0.1;

    public RetryPolicy {
        if (retries < 0) {
            throw new IllegalArgumentException("retries cannot be negative: " + retries);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least baseDelay");
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO);
    }

    public int maxAttempts() {
        return retries + 1;
    }

    /**
     * @param attempt zero-based index of the attempt that just failed
     * @param jitterUnit uniform sample in {@code [0, 1)}
     */
    public Duration delayFor(int attempt, double jitterUnit) {
        long baseMs = baseDelay.toMillis();
        long maxMs = maxDelay.toMillis();
        long backoff = baseMs;
        for (int i = 0; i < attempt; i++) {
            if (backoff >= maxMs / 2L) {
                backoff = maxMs;
                break;
            }
            backoff *= 2L;
        }
        double unit = Math.min(Math.max(jitterUnit, 0.0), 1.0);
        long jitter = (long) (baseMs * JITTER_FRACTION * unit);
        return Duration.ofMillis(Math.min(maxMs, backoff + jitter));
    }
}
