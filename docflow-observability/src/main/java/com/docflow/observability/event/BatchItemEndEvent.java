package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

/** A forEach item finished; items may complete out of index order. */
public record BatchItemEndEvent(
        TraceContext trace,
        String stepId,
        int itemIndex,
        int totalItems,
        boolean success,
        Throwable error,
        long durationMs
) implements FlowEvent {
}
