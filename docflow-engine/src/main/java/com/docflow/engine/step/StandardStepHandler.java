package com.docflow.engine.step;

import com.docflow.engine.ExecutionContext;
import com.docflow.engine.build.PlannedStep;
import com.docflow.flowdefinition.step.StandardStep;
import com.docflow.flowdefinition.step.StepKind;

import java.util.Set;

/**
 * Parse, extract, split and categorize steps: one provider call (or consensus over several).
 */
public final class StandardStepHandler implements StepHandler {

    @Override
    public Set<StepKind> supportedKinds() {
        return Set.of(StepKind.STANDARD);
    }

    @Override
    public StepOutcome dispatch(PlannedStep step, Object input, ExecutionContext ctx, FlowScope scope,
                                HandlerContext hc) {
        StandardStep standard = step.as(StandardStep.class);
        ProviderStepOutcome outcome = hc.getProviderInvoker().invoke(step, standard.getNodeType().toValue(),
                standard.getConfig(), input, scope);
        ctx.addMetric(outcome.metric());
        return StepOutcome.of(outcome.value());
    }
}
