package com.docflow.consensus;

import com.docflow.observability.TraceContext;

/** Step and trace a consensus execution belongs to. */
public record ConsensusScope(String stepId, TraceContext trace) {
}
