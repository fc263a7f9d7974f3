package com.docflow.resilience;

/**
 * Retry settings of the fallback manager. Attempts per provider are {@code maxRetries + 1}; the first
 * provider of a chain uses {@code primaryMaxRetries} instead when set.
 * Defaults: 2 retries, 1000 ms base delay, 30000 ms cap, exponential backoff, up to 1000 ms jitter.
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final long DEFAULT_BASE_DELAY_MS = 1000L;
    public static final long DEFAULT_MAX_DELAY_MS = 30_000L;
    public static final long DEFAULT_JITTER_MS = 1000L;

    private final int maxRetries;
    private final Integer primaryMaxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final boolean exponentialBackoff;
    private final long jitterMs;

    private RetryPolicy(Builder b) {
        this.maxRetries = b.maxRetries;
        this.primaryMaxRetries = b.primaryMaxRetries;
        this.baseDelayMs = b.baseDelayMs;
        this.maxDelayMs = b.maxDelayMs;
        this.exponentialBackoff = b.exponentialBackoff;
        this.jitterMs = b.jitterMs;
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Total attempts for the provider at {@code providerIndex} in the chain (0 = primary). */
    public int maxAttemptsFor(int providerIndex) {
        int retries = providerIndex == 0 && primaryMaxRetries != null ? primaryMaxRetries : maxRetries;
        return retries + 1;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /** Null when the primary provider uses {@link #getMaxRetries()}. */
    public Integer getPrimaryMaxRetries() {
        return primaryMaxRetries;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public boolean isExponentialBackoff() {
        return exponentialBackoff;
    }

    public long getJitterMs() {
        return jitterMs;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", primaryMaxRetries=" + primaryMaxRetries
                + ", baseDelayMs=" + baseDelayMs + ", maxDelayMs=" + maxDelayMs
                + ", exponentialBackoff=" + exponentialBackoff + ", jitterMs=" + jitterMs + "}";
    }

    public static final class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Integer primaryMaxRetries;
        private long baseDelayMs = DEFAULT_BASE_DELAY_MS;
        private long maxDelayMs = DEFAULT_MAX_DELAY_MS;
        private boolean exponentialBackoff = true;
        private long jitterMs = DEFAULT_JITTER_MS;

        private Builder() {
        }

        public Builder maxRetries(int value) {
            if (value < 0) throw new IllegalArgumentException("maxRetries must be >= 0: " + value);
            this.maxRetries = value;
            return this;
        }

        public Builder primaryMaxRetries(Integer value) {
            if (value != null && value < 0) throw new IllegalArgumentException("primaryMaxRetries must be >= 0: " + value);
            this.primaryMaxRetries = value;
            return this;
        }

        public Builder baseDelayMs(long value) {
            this.baseDelayMs = Math.max(0L, value);
            return this;
        }

        public Builder maxDelayMs(long value) {
            this.maxDelayMs = Math.max(0L, value);
            return this;
        }

        public Builder exponentialBackoff(boolean value) {
            this.exponentialBackoff = value;
            return this;
        }

        /** Upper bound of the random delay added to each backoff; 0 disables jitter. */
        public Builder jitterMs(long value) {
            this.jitterMs = Math.max(0L, value);
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
