package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

public record FlowErrorEvent(TraceContext trace, String flowId, String failedStepId, Throwable error, long durationMs)
        implements FlowEvent {
}
