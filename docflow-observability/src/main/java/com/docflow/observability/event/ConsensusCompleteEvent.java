package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

public record ConsensusCompleteEvent(
        TraceContext trace,
        String stepId,
        double agreement,
        int successfulRuns,
        int failedRuns,
        boolean tieBreakerUsed,
        boolean retried
) implements FlowEvent {
}
