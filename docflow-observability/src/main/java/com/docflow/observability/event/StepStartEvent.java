package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

import java.util.List;

/**
 * @param flowPath ids of the enclosing composite steps, outermost first; empty at top level
 */
public record StepStartEvent(TraceContext trace, String stepId, String stepType, List<String> flowPath)
        implements FlowEvent {

    public StepStartEvent {
        flowPath = flowPath != null ? List.copyOf(flowPath) : List.of();
    }
}
