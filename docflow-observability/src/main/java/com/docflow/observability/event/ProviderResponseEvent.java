package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

public record ProviderResponseEvent(
        TraceContext trace,
        String stepId,
        String providerKey,
        int attemptNumber,
        long tokensIn,
        long tokensOut,
        double costUsd,
        long durationMs
) implements FlowEvent {
}
