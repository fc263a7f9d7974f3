package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

public record BatchEndEvent(
        TraceContext trace,
        String stepId,
        int totalItems,
        int successfulItems,
        int failedItems,
        long durationMs
) implements FlowEvent {
}
