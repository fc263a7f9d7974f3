package com.docflow.resilience;

import com.docflow.observability.TraceContext;

/**
 * Step and trace a provider call belongs to; carried into hook events and log lines.
 */
public record CallScope(String stepId, TraceContext trace) {

    public static CallScope of(String stepId) {
        return new CallScope(stepId, TraceContext.root(true));
    }
}
