package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

/** Emitted before every provider attempt; {@code attemptNumber} starts at 1 per provider. */
public record ProviderRequestEvent(TraceContext trace, String stepId, String providerKey, int attemptNumber, int maxAttempts)
        implements FlowEvent {
}
