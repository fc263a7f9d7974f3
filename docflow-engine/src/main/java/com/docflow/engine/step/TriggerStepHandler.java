package com.docflow.engine.step;

import com.docflow.engine.ExecutionContext;
import com.docflow.engine.ExecutionException;
import com.docflow.engine.StepMetric;
import com.docflow.engine.build.ExecutableFlow;
import com.docflow.engine.build.PlannedStep;
import com.docflow.flowdefinition.step.StepKind;
import com.docflow.flowdefinition.step.TriggerStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs another flow. The input mapping shapes the child's input; provider overrides were applied when the
 * child was built. With {@code timeoutMs} the child runs on its own thread and is abandoned on expiry.
 */
public final class TriggerStepHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(TriggerStepHandler.class);

    static final String WRAPPER_TYPE = "trigger";

    @Override
    public Set<StepKind> supportedKinds() {
        return Set.of(StepKind.TRIGGER);
    }

    @Override
    public StepOutcome dispatch(PlannedStep step, Object input, ExecutionContext ctx, FlowScope scope,
                                HandlerContext hc) {
        long start = System.currentTimeMillis();
        try {
            return runChild(step, input, ctx, scope, hc, start);
        } catch (RuntimeException e) {
            ctx.addMetric(StepMetric.failedWrapper(step.getId(), WRAPPER_TYPE, System.currentTimeMillis() - start,
                    0, e));
            throw e;
        }
    }

    private StepOutcome runChild(PlannedStep step, Object input, ExecutionContext ctx, FlowScope scope,
                                 HandlerContext hc, long start) {
        TriggerStep trigger = step.as(TriggerStep.class);
        ExecutableFlow child = step.getChildFlow();
        if (scope.callStack().contains(child.getId())) {
            throw new ExecutionException(step.getId(), scope.flowPath(), "Circular flow reference: "
                    + String.join(" -> ", scope.callStack()) + " -> " + child.getId(), null);
        }
        if (scope.callStack().size() >= hc.getConfig().getMaxFlowDepth()) {
            throw new ExecutionException(step.getId(), scope.flowPath(),
                    "Maximum flow depth " + hc.getConfig().getMaxFlowDepth() + " exceeded", null);
        }
        Object childInput = InputMappingResolver.apply(trigger.getInputMapping(), input, ctx.getArtifacts());
        FlowScope childScope = scope.nested(step.getId()).enter(child.getId());

        SubFlowOutcome outcome = trigger.getTimeoutMs() == null
                ? hc.getSubFlowRunner().run(child, childInput, childScope)
                : runWithTimeout(step, child, childInput, childScope, trigger.getTimeoutMs(), scope, hc);

        if (trigger.isMergeMetrics()) {
            ctx.addNestedMetrics(step.getId(), outcome.metrics());
        }
        ctx.addMetric(StepMetric.wrapper(step.getId(), null, outcome.metrics(), System.currentTimeMillis() - start,
                WRAPPER_TYPE, 0, 0, 0));
        return StepOutcome.of(outcome.output());
    }

    private static SubFlowOutcome runWithTimeout(PlannedStep step, ExecutableFlow child, Object childInput,
                                                 FlowScope childScope, long timeoutMs, FlowScope scope,
                                                 HandlerContext hc) {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "docflow-trigger-" + step.getId());
            t.setDaemon(true);
            return t;
        });
        CompletableFuture<SubFlowOutcome> future = CompletableFuture.supplyAsync(
                () -> hc.getSubFlowRunner().run(child, childInput, childScope), executor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Trigger {} abandoned flow {} after {} ms", step.getId(), child.getId(), timeoutMs);
            throw new ExecutionException(step.getId(), scope.flowPath(),
                    "Flow execution timeout after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionException(step.getId(), scope.flowPath(), "Trigger interrupted", e);
        } catch (java.util.concurrent.ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new ExecutionException(step.getId(), scope.flowPath(), cause);
        } finally {
            executor.shutdown();
        }
    }
}
