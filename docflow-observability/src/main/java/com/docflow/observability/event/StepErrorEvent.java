package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

public record StepErrorEvent(TraceContext trace, String stepId, String stepType, Throwable error, long durationMs)
        implements FlowEvent {
}
