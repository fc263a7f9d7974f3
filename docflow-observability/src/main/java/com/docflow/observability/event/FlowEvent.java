package com.docflow.observability.event;

import com.docflow.observability.TraceContext;

/** Common shape of every hook event. */
public interface FlowEvent {

    TraceContext trace();
}
