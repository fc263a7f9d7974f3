package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

/** Flow finished; totals are summed over every recorded step metric, nested ones included. */
public record FlowEndEvent(
        TraceContext trace,
        String flowId,
        long durationMs,
        Object output,
        long totalTokensIn,
        long totalTokensOut,
        double totalCostUsd
) implements FlowEvent {
}
