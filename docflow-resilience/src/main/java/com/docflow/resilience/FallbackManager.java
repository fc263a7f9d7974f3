package com.docflow.resilience;

import com.docflow.observability.HookDispatcher;
import com.docflow.observability.event.CircuitBreakerTriggeredEvent;
import com.docflow.observability.event.ProviderRequestEvent;
import com.docflow.observability.event.ProviderResponseEvent;
import com.docflow.observability.event.ProviderRetryEvent;
import com.docflow.provider.ProviderInstance;
import com.docflow.provider.ProviderResponse;
import com.docflow.resilience.breaker.CircuitBreaker;
import com.docflow.resilience.breaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;

/**
 * Calls an ordered chain of providers until one answers.
 * <p>
 * Per provider: skip it when its breaker is open; otherwise attempt up to
 * {@link RetryPolicy#maxAttemptsFor(int)} times, backing off between retryable failures and giving up on
 * the provider at the first non-retryable one. A success resets the provider's breaker and returns
 * immediately; an exhausted provider records one breaker failure and the next provider is tried.
 */
public final class FallbackManager {

    private static final Logger log = LoggerFactory.getLogger(FallbackManager.class);

    private final RetryPolicy policy;
    private final CircuitBreakerRegistry breakers;
    private final HookDispatcher hooks;
    private final Sleeper sleeper;
    private final DoubleSupplier jitter;

    private FallbackManager(Builder b) {
        this.policy = b.policy != null ? b.policy : RetryPolicy.defaults();
        this.breakers = b.breakers != null ? b.breakers : CircuitBreakerRegistry.withDefaults();
        this.hooks = b.hooks != null ? b.hooks : HookDispatcher.noop();
        this.sleeper = b.sleeper != null ? b.sleeper : Sleeper.SYSTEM;
        this.jitter = b.jitter != null ? b.jitter : () -> ThreadLocalRandom.current().nextDouble();
    }

    public static Builder builder() {
        return new Builder();
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return breakers;
    }

    /**
     * @param providers primary first, then fallbacks in order
     * @param call      one attempt against one provider
     * @param scope     step and trace for hooks and logs
     * @return the first valid response
     * @throws ProvidersExhaustedException when every provider failed or was skipped
     */
    public FallbackResult callWithFallback(List<? extends ProviderInstance> providers, ProviderCall call, CallScope scope) {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(scope, "scope");
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("No providers configured for step " + scope.stepId());
        }
        List<ProviderFailure> failures = new ArrayList<>();
        for (int index = 0; index < providers.size(); index++) {
            ProviderInstance provider = providers.get(index);
            String key = provider.identity().key();
            CircuitBreaker breaker = breakers.breakerFor(key);
            if (!breaker.tryAcquire()) {
                log.warn("Step {} skipping provider {}: circuit breaker open after {} consecutive failures",
                        scope.stepId(), key, breaker.getConsecutiveFailures());
                hooks.onCircuitBreakerTriggered(new CircuitBreakerTriggeredEvent(
                        scope.trace(), scope.stepId(), key, breaker.getConsecutiveFailures()));
                failures.add(ProviderFailure.skipped(key));
                continue;
            }
            FallbackResult result = attemptProvider(provider, index, breaker, call, scope, failures);
            if (result != null) {
                return result;
            }
        }
        log.error("Step {} all {} providers failed", scope.stepId(), providers.size());
        throw new ProvidersExhaustedException(scope.stepId(), failures);
    }

    private FallbackResult attemptProvider(ProviderInstance provider, int index, CircuitBreaker breaker,
                                           ProviderCall call, CallScope scope, List<ProviderFailure> failures) {
        String key = provider.identity().key();
        int maxAttempts = policy.maxAttemptsFor(index);
        Throwable last = null;
        int attempts = 0;
        boolean succeeded = false;
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                attempts = attempt;
                hooks.onProviderRequest(new ProviderRequestEvent(scope.trace(), scope.stepId(), key, attempt, maxAttempts));
                long start = System.nanoTime();
                ProviderResponse response;
                try {
                    response = call.invoke(provider);
                    if (response == null || response.value() == null) {
                        throw new InvalidProviderResponseException(key);
                    }
                } catch (Exception e) {
                    last = e;
                    if (!shouldRetry(key, attempt, maxAttempts, e, scope)) {
                        break;
                    }
                    backOff(key, attempt, maxAttempts, e, scope);
                    continue;
                }
                long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                succeeded = true;
                breaker.recordSuccess();
                hooks.onProviderResponse(new ProviderResponseEvent(scope.trace(), scope.stepId(), key, attempt,
                        response.tokensIn(), response.tokensOut(), response.costUsd(), durationMs));
                if (index > 0 || attempt > 1) {
                    log.info("Step {} provider {} succeeded on attempt {}/{} (chain position {})",
                            scope.stepId(), key, attempt, maxAttempts, index);
                }
                return new FallbackResult(response, provider, index, attempt);
            }
        } finally {
            if (!succeeded && breaker.recordFailure()) {
                log.warn("Circuit breaker opened for provider {} after {} consecutive failures",
                        key, breaker.getConsecutiveFailures());
            }
        }
        failures.add(new ProviderFailure(key, attempts, last, false));
        return null;
    }

    private boolean shouldRetry(String key, int attempt, int maxAttempts, Exception e, CallScope scope) {
        if (attempt >= maxAttempts) {
            log.warn("Step {} provider {} attempt {}/{} failed: {}; attempts exhausted",
                    scope.stepId(), key, attempt, maxAttempts, e.getMessage());
            return false;
        }
        if (!RetryableErrorClassifier.isRetryable(e)) {
            log.warn("Step {} provider {} attempt {}/{} failed: {}; error not retryable",
                    scope.stepId(), key, attempt, maxAttempts, e.getMessage());
            return false;
        }
        return true;
    }

    private void backOff(String key, int attempt, int maxAttempts, Exception e, CallScope scope) {
        long delayMs = RetryDelayCalculator.computeDelayMs(attempt, policy, e, jitter.getAsDouble());
        log.info("Step {} provider {} attempt {}/{} failed: {}; retrying in {} ms",
                scope.stepId(), key, attempt, maxAttempts, e.getMessage(), delayMs);
        hooks.onProviderRetry(new ProviderRetryEvent(scope.trace(), scope.stepId(), key, attempt, maxAttempts, delayMs, e));
        if (delayMs <= 0) return;
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while backing off provider " + key, ie);
        }
    }

    public static final class Builder {
        private RetryPolicy policy;
        private CircuitBreakerRegistry breakers;
        private HookDispatcher hooks;
        private Sleeper sleeper;
        private DoubleSupplier jitter;

        private Builder() {
        }

        public Builder policy(RetryPolicy value) {
            this.policy = value;
            return this;
        }

        public Builder circuitBreakers(CircuitBreakerRegistry value) {
            this.breakers = value;
            return this;
        }

        public Builder hooks(HookDispatcher value) {
            this.hooks = value;
            return this;
        }

        public Builder sleeper(Sleeper value) {
            this.sleeper = value;
            return this;
        }

        /** Source of uniform [0, 1) values for backoff jitter. */
        public Builder jitter(DoubleSupplier value) {
            this.jitter = value;
            return this;
        }

        public FallbackManager build() {
            return new FallbackManager(this);
        }
    }
}
