package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

public record FlowStartEvent(TraceContext trace, String flowId, int stepCount, long timestampMs) implements FlowEvent {
}
