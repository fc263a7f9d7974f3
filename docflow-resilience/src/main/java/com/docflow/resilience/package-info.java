/**
 * Provider resilience: bounded retries with exponential backoff, per-provider circuit breakers and
 * escalation through an ordered fallback chain.
 *
 * <ul>
 *   <li>{@link com.docflow.resilience.FallbackManager#callWithFallback} – the single entry point</li>
 *   <li>{@link com.docflow.resilience.RetryPolicy} – retry counts and delay bounds</li>
 *   <li>{@link com.docflow.resilience.RetryableErrorClassifier} – status-code / message heuristics, Retry-After parsing</li>
 *   <li>{@link com.docflow.resilience.RetryDelayCalculator} – {@code min(maxDelay, base * 2^(attempt-1) + jitter)}</li>
 *   <li>{@link com.docflow.resilience.breaker.CircuitBreakerRegistry} – injectable registry of breakers keyed by {@code vendor:model}</li>
 * </ul>
 */
package com.docflow.resilience;
