package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

public record BatchStartEvent(TraceContext trace, String stepId, int totalItems) implements FlowEvent {
}
