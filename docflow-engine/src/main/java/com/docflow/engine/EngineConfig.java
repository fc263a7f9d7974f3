package com.docflow.engine;

import com.docflow.resilience.RetryPolicy;
import com.docflow.resilience.breaker.CircuitBreakerRegistry;

import java.time.Duration;
import java.util.Map;

/**
 * Engine configuration loaded from environment variables.
 * <p>
 * ForEach: DOCFLOW_FOREACH_CONCURRENCY (default 4), DOCFLOW_FOREACH_MIN_SUCCESS (default 1).
 * Sub-flows: DOCFLOW_MAX_FLOW_DEPTH (default 10).
 * Retry: DOCFLOW_MAX_RETRIES, DOCFLOW_PRIMARY_MAX_RETRIES, DOCFLOW_RETRY_DELAY_MS, DOCFLOW_MAX_RETRY_DELAY_MS.
 * Circuit breaker: DOCFLOW_CB_THRESHOLD, DOCFLOW_CB_RESET_TIMEOUT_MS.
 * Hooks: DOCFLOW_HOOKS_FIRE_AND_FORGET, DOCFLOW_HOOK_SAMPLING_RATE.
 * Unparseable values fall back to the defaults.
 */
public final class EngineConfig {

    private static final String ENV_FOREACH_CONCURRENCY = "DOCFLOW_FOREACH_CONCURRENCY";
    private static final String ENV_FOREACH_MIN_SUCCESS = "DOCFLOW_FOREACH_MIN_SUCCESS";
    private static final String ENV_MAX_FLOW_DEPTH = "DOCFLOW_MAX_FLOW_DEPTH";
    private static final String ENV_MAX_RETRIES = "DOCFLOW_MAX_RETRIES";
    private static final String ENV_PRIMARY_MAX_RETRIES = "DOCFLOW_PRIMARY_MAX_RETRIES";
    private static final String ENV_RETRY_DELAY_MS = "DOCFLOW_RETRY_DELAY_MS";
    private static final String ENV_MAX_RETRY_DELAY_MS = "DOCFLOW_MAX_RETRY_DELAY_MS";
    private static final String ENV_CB_THRESHOLD = "DOCFLOW_CB_THRESHOLD";
    private static final String ENV_CB_RESET_TIMEOUT_MS = "DOCFLOW_CB_RESET_TIMEOUT_MS";
    private static final String ENV_HOOKS_FIRE_AND_FORGET = "DOCFLOW_HOOKS_FIRE_AND_FORGET";
    private static final String ENV_HOOK_SAMPLING_RATE = "DOCFLOW_HOOK_SAMPLING_RATE";

    public static final int DEFAULT_FOREACH_CONCURRENCY = 4;
    public static final int DEFAULT_MIN_SUCCESSFUL_ITEMS = 1;
    public static final int DEFAULT_MAX_FLOW_DEPTH = 10;

    private final int forEachConcurrency;
    private final int minSuccessfulItems;
    private final int maxFlowDepth;
    private final int maxRetries;
    private final Integer primaryMaxRetries;
    private final long retryDelayMs;
    private final long maxRetryDelayMs;
    private final int circuitBreakerThreshold;
    private final long circuitBreakerResetTimeoutMs;
    private final boolean hooksFireAndForget;
    private final double hookSamplingRate;

    private EngineConfig(Builder b) {
        this.forEachConcurrency = Math.max(1, b.forEachConcurrency);
        this.minSuccessfulItems = Math.max(0, b.minSuccessfulItems);
        this.maxFlowDepth = Math.max(1, b.maxFlowDepth);
        this.maxRetries = Math.max(0, b.maxRetries);
        this.primaryMaxRetries = b.primaryMaxRetries != null ? Math.max(0, b.primaryMaxRetries) : null;
        this.retryDelayMs = Math.max(0, b.retryDelayMs);
        this.maxRetryDelayMs = Math.max(this.retryDelayMs, b.maxRetryDelayMs);
        this.circuitBreakerThreshold = Math.max(1, b.circuitBreakerThreshold);
        this.circuitBreakerResetTimeoutMs = Math.max(0, b.circuitBreakerResetTimeoutMs);
        this.hooksFireAndForget = b.hooksFireAndForget;
        this.hookSamplingRate = Double.isFinite(b.hookSamplingRate)
                ? Math.min(1.0, Math.max(0.0, b.hookSamplingRate))
                : 1.0;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static EngineConfig fromEnvironment(Map<String, String> env) {
        String primary = env.get(ENV_PRIMARY_MAX_RETRIES);
        return builder()
                .forEachConcurrency(parseInt(env.get(ENV_FOREACH_CONCURRENCY), DEFAULT_FOREACH_CONCURRENCY))
                .minSuccessfulItems(parseInt(env.get(ENV_FOREACH_MIN_SUCCESS), DEFAULT_MIN_SUCCESSFUL_ITEMS))
                .maxFlowDepth(parseInt(env.get(ENV_MAX_FLOW_DEPTH), DEFAULT_MAX_FLOW_DEPTH))
                .maxRetries(parseInt(env.get(ENV_MAX_RETRIES), RetryPolicy.DEFAULT_MAX_RETRIES))
                .primaryMaxRetries(primary == null || primary.isBlank() ? null : parseInt(primary, RetryPolicy.DEFAULT_MAX_RETRIES))
                .retryDelayMs(parseLong(env.get(ENV_RETRY_DELAY_MS), RetryPolicy.DEFAULT_BASE_DELAY_MS))
                .maxRetryDelayMs(parseLong(env.get(ENV_MAX_RETRY_DELAY_MS), RetryPolicy.DEFAULT_MAX_DELAY_MS))
                .circuitBreakerThreshold(parseInt(env.get(ENV_CB_THRESHOLD), CircuitBreakerRegistry.DEFAULT_THRESHOLD))
                .circuitBreakerResetTimeoutMs(parseLong(env.get(ENV_CB_RESET_TIMEOUT_MS),
                        CircuitBreakerRegistry.DEFAULT_RESET_TIMEOUT.toMillis()))
                .hooksFireAndForget(parseBoolean(env.get(ENV_HOOKS_FIRE_AND_FORGET), false))
                .hookSamplingRate(parseDouble(env.get(ENV_HOOK_SAMPLING_RATE), 1.0))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static double parseDouble(String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public RetryPolicy toRetryPolicy() {
        return RetryPolicy.builder()
                .maxRetries(maxRetries)
                .primaryMaxRetries(primaryMaxRetries)
                .baseDelayMs(retryDelayMs)
                .maxDelayMs(maxRetryDelayMs)
                .build();
    }

    public CircuitBreakerRegistry toCircuitBreakerRegistry() {
        return new CircuitBreakerRegistry(circuitBreakerThreshold, Duration.ofMillis(circuitBreakerResetTimeoutMs));
    }

    public int getForEachConcurrency() {
        return forEachConcurrency;
    }

    public int getMinSuccessfulItems() {
        return minSuccessfulItems;
    }

    public int getMaxFlowDepth() {
        return maxFlowDepth;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Integer getPrimaryMaxRetries() {
        return primaryMaxRetries;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public long getMaxRetryDelayMs() {
        return maxRetryDelayMs;
    }

    public int getCircuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public long getCircuitBreakerResetTimeoutMs() {
        return circuitBreakerResetTimeoutMs;
    }

    public boolean isHooksFireAndForget() {
        return hooksFireAndForget;
    }

    public double getHookSamplingRate() {
        return hookSamplingRate;
    }

    public static final class Builder {
        private int forEachConcurrency = DEFAULT_FOREACH_CONCURRENCY;
        private int minSuccessfulItems = DEFAULT_MIN_SUCCESSFUL_ITEMS;
        private int maxFlowDepth = DEFAULT_MAX_FLOW_DEPTH;
        private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
        private Integer primaryMaxRetries;
        private long retryDelayMs = RetryPolicy.DEFAULT_BASE_DELAY_MS;
        private long maxRetryDelayMs = RetryPolicy.DEFAULT_MAX_DELAY_MS;
        private int circuitBreakerThreshold = CircuitBreakerRegistry.DEFAULT_THRESHOLD;
        private long circuitBreakerResetTimeoutMs = CircuitBreakerRegistry.DEFAULT_RESET_TIMEOUT.toMillis();
        private boolean hooksFireAndForget;
        private double hookSamplingRate = 1.0;

        private Builder() {
        }

        public Builder forEachConcurrency(int value) {
            this.forEachConcurrency = value;
            return this;
        }

        public Builder minSuccessfulItems(int value) {
            this.minSuccessfulItems = value;
            return this;
        }

        public Builder maxFlowDepth(int value) {
            this.maxFlowDepth = value;
            return this;
        }

        public Builder maxRetries(int value) {
            this.maxRetries = value;
            return this;
        }

        public Builder primaryMaxRetries(Integer value) {
            this.primaryMaxRetries = value;
            return this;
        }

        public Builder retryDelayMs(long value) {
            this.retryDelayMs = value;
            return this;
        }

        public Builder maxRetryDelayMs(long value) {
            this.maxRetryDelayMs = value;
            return this;
        }

        public Builder circuitBreakerThreshold(int value) {
            this.circuitBreakerThreshold = value;
            return this;
        }

        public Builder circuitBreakerResetTimeoutMs(long value) {
            this.circuitBreakerResetTimeoutMs = value;
            return this;
        }

        public Builder hooksFireAndForget(boolean value) {
            this.hooksFireAndForget = value;
            return this;
        }

        public Builder hookSamplingRate(double value) {
            this.hookSamplingRate = value;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
