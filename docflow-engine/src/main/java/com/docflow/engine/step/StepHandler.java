package com.docflow.engine.step;

import com.docflow.engine.ExecutionContext;
import com.docflow.engine.build.PlannedStep;
import com.docflow.flowdefinition.step.StepKind;

import java.util.Set;

/**
 * Single responsibility: execute steps of one or more kinds.
 */
public interface StepHandler {

    Set<StepKind> supportedKinds();

    /**
     * @param input output of the previous step, or the flow input for the first step
     */
    StepOutcome dispatch(PlannedStep step, Object input, ExecutionContext ctx, FlowScope scope, HandlerContext hc);
}
