package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

public record ConsensusStartEvent(TraceContext trace, String stepId, int runs, String strategy, String onTie)
        implements FlowEvent {
}
