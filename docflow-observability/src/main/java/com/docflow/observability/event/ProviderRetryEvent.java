package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

/** A retryable attempt failed; the next attempt starts after {@code delayMs}. */
public record ProviderRetryEvent(
        TraceContext trace,
        String stepId,
        String providerKey,
        int attemptNumber,
        int maxAttempts,
        long delayMs,
        Throwable error
) implements FlowEvent {
}
