package com.docflow.engine.step;

import com.docflow.engine.ExecutionContext;
import com.docflow.engine.ExecutionException;
import com.docflow.engine.StepMetric;
import com.docflow.engine.build.ExecutableFlow;
import com.docflow.engine.build.PlannedStep;
import com.docflow.flowdefinition.step.ConditionalStep;
import com.docflow.flowdefinition.step.StepKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Classifies the step input and runs the branch mapped to the label, against the same input.
 * <p>
 * Artifacts besides the branch output under the step id: {@code <id>:category} (the label) and
 * {@code <id>:branchArtifacts} (the branch's own artifacts). Branch metrics are merged under
 * {@code <id>.branch.<label>}, followed by a wrapper metric for the whole step (a failed one when the step
 * fails).
 */
public final class ConditionalStepHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(ConditionalStepHandler.class);

    static final String CATEGORY_FIELD = "category";
    static final String WRAPPER_TYPE = "conditional";

    @Override
    public Set<StepKind> supportedKinds() {
        return Set.of(StepKind.CONDITIONAL);
    }

    @Override
    public StepOutcome dispatch(PlannedStep step, Object input, ExecutionContext ctx, FlowScope scope,
                                HandlerContext hc) {
        long start = System.currentTimeMillis();
        try {
            return classifyAndRoute(step, input, ctx, scope, hc, start);
        } catch (RuntimeException e) {
            ctx.addMetric(StepMetric.failedWrapper(step.getId(), WRAPPER_TYPE, System.currentTimeMillis() - start,
                    0, e));
            throw e;
        }
    }

    private StepOutcome classifyAndRoute(PlannedStep step, Object input, ExecutionContext ctx, FlowScope scope,
                                         HandlerContext hc, long start) {
        ConditionalStep conditional = step.as(ConditionalStep.class);
        ProviderStepOutcome classified = hc.getProviderInvoker().invoke(step, "categorize", conditional.getConfig(),
                input, scope);
        ctx.addMetric(classified.metric());

        String label = labelOf(classified.value());
        if (label == null) {
            throw new ExecutionException(step.getId(), scope.flowPath(),
                    "Classifier returned no category: " + classified.value(), null);
        }
        ExecutableFlow branch = step.getBranches().get(label);
        if (branch == null) {
            throw new ExecutionException(step.getId(), scope.flowPath(),
                    "No branch for category '" + label + "' (branches: " + step.getBranches().keySet() + ")", null);
        }
        log.debug("Conditional {} selected branch {}", step.getId(), label);
        ctx.putArtifact(step.getId() + ":category", label);

        SubFlowOutcome outcome = hc.getSubFlowRunner().run(branch, input, scope.nested(step.getId()));
        ctx.putArtifact(step.getId() + ":branchArtifacts", outcome.artifacts());
        ctx.addNestedMetrics(step.getId() + ".branch." + label, outcome.metrics());
        ctx.addMetric(StepMetric.wrapper(step.getId(), classified.metric(), outcome.metrics(),
                System.currentTimeMillis() - start, WRAPPER_TYPE, 0, 0, 0));
        return StepOutcome.of(outcome.output());
    }

    static String labelOf(Object value) {
        if (value instanceof String s) {
            return s.isBlank() ? null : s.trim();
        }
        if (value instanceof Map<?, ?> map) {
            Object category = map.get(CATEGORY_FIELD);
            return category != null ? labelOf(category.toString()) : null;
        }
        return null;
    }
}
