package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

/** A provider was skipped because its circuit breaker is open. */
public record CircuitBreakerTriggeredEvent(TraceContext trace, String stepId, String providerKey, int consecutiveFailures)
        implements FlowEvent {
}
