package com.docflow.resilience.breaker;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Circuit breakers by provider key ({@code vendor:model}). Entries never expire. Create one per process
 * (or per test) and pass it to every {@link com.docflow.resilience.FallbackManager} that should share
 * breaker state. Defaults: threshold 3, reset timeout 30 s.
 */
public final class CircuitBreakerRegistry {

    public static final int DEFAULT_THRESHOLD = 3;
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(30);

    private final int threshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(int threshold, Duration resetTimeout, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1: " + threshold);
        }
        this.threshold = threshold;
        this.resetTimeout = Objects.requireNonNull(resetTimeout, "resetTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CircuitBreakerRegistry(int threshold, Duration resetTimeout) {
        this(threshold, resetTimeout, Clock.systemUTC());
    }

    public static CircuitBreakerRegistry withDefaults() {
        return new CircuitBreakerRegistry(DEFAULT_THRESHOLD, DEFAULT_RESET_TIMEOUT);
    }

    /** Breaker for the key, created on first use. */
    public CircuitBreaker breakerFor(String providerKey) {
        Objects.requireNonNull(providerKey, "providerKey");
        return breakers.computeIfAbsent(providerKey,
                k -> new CircuitBreaker(k, threshold, resetTimeout.toMillis(), clock));
    }

    public Optional<CircuitBreaker> find(String providerKey) {
        return providerKey != null ? Optional.ofNullable(breakers.get(providerKey)) : Optional.empty();
    }

    public Set<String> keys() {
        return Set.copyOf(breakers.keySet());
    }

    public int getThreshold() {
        return threshold;
    }

    public Duration getResetTimeout() {
        return resetTimeout;
    }

    /** Drops every breaker. */
    public void clear() {
        breakers.clear();
    }
}
