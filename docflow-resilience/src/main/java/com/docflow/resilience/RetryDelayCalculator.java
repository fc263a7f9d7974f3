package com.docflow.resilience;

/**
 * Backoff delays. Without a Retry-After hint the delay before retry number {@code attempt} (1-based) is
 * {@code min(maxDelay, base * 2^(attempt-1) + jitter)}, or {@code min(maxDelay, base + jitter)} when
 * exponential backoff is off. A Retry-After hint replaces the computed value, capped at maxDelay.
 */
public final class RetryDelayCalculator {

    private RetryDelayCalculator() {
    }

    /**
     * @param attempt        the attempt that just failed, starting at 1
     * @param lastError      the failure, inspected for a Retry-After hint; may be null
     * @param jitterFraction uniform value in [0, 1) scaled by {@link RetryPolicy#getJitterMs()}
     */
    public static long computeDelayMs(int attempt, RetryPolicy policy, Throwable lastError, double jitterFraction) {
        Long retryAfter = RetryableErrorClassifier.retryAfterMs(lastError);
        if (retryAfter != null) {
            return Math.min(retryAfter, policy.getMaxDelayMs());
        }
        long jitter = (long) (Math.max(0.0, Math.min(1.0, jitterFraction)) * policy.getJitterMs());
        long base = baseDelayMs(attempt, policy);
        return Math.min(policy.getMaxDelayMs(), base + jitter);
    }

    /** Delay without jitter or Retry-After; non-decreasing in {@code attempt} and never above maxDelay. */
    public static long baseDelayMs(int attempt, RetryPolicy policy) {
        int exponent = Math.max(0, attempt - 1);
        double raw = policy.isExponentialBackoff()
                ? policy.getBaseDelayMs() * Math.pow(2, exponent)
                : policy.getBaseDelayMs();
        return (long) Math.min(raw, (double) policy.getMaxDelayMs());
    }
}
