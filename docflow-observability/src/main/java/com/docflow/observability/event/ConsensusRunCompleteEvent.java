package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

/** One consensus run finished. Emitted in run index order; {@code error} is null on success. */
public record ConsensusRunCompleteEvent(
        TraceContext trace,
        String stepId,
        int runIndex,
        boolean success,
        Throwable error,
        long durationMs
) implements FlowEvent {
}
