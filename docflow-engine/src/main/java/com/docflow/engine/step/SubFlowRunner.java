package com.docflow.engine.step;

import com.docflow.engine.build.ExecutableFlow;

/**
 * Runs a sub-flow with a fresh execution context. Failures propagate as
 * {@link com.docflow.engine.ExecutionException}.
 */
@FunctionalInterface
public interface SubFlowRunner {

    SubFlowOutcome run(ExecutableFlow flow, Object input, FlowScope scope);
}
