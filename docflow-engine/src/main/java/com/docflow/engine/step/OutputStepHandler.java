package com.docflow.engine.step;

import com.docflow.engine.ExecutionContext;
import com.docflow.engine.build.PlannedStep;
import com.docflow.flowdefinition.step.OutputStep;
import com.docflow.flowdefinition.step.StepKind;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Records a named output from earlier artifacts (or the step input when no source is given).
 * Never calls providers; the input passes through to the next step unchanged.
 */
public final class OutputStepHandler implements StepHandler {

    @Override
    public Set<StepKind> supportedKinds() {
        return Set.of(StepKind.OUTPUT);
    }

    @Override
    public StepOutcome dispatch(PlannedStep step, Object input, ExecutionContext ctx, FlowScope scope,
                                HandlerContext hc) {
        OutputStep output = step.as(OutputStep.class);
        Map<String, Object> sources = new LinkedHashMap<>();
        if (output.getSource().isEmpty()) {
            sources.put(step.getId(), input);
        } else {
            for (String source : output.getSource()) {
                sources.put(source, ctx.getArtifact(source));
            }
        }
        Object value = OutputTransformer.apply(output.getTransform(), sources, output.getFields());
        ctx.putOutput(output.getOutputName(), value);
        return new StepOutcome(value, input);
    }
}
