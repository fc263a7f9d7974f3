package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

public record StepEndEvent(TraceContext trace, String stepId, String stepType, long durationMs, Object output)
        implements FlowEvent {
}
