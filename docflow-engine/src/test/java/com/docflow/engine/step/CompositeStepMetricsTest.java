package com.docflow.engine.step;

import com.docflow.consensus.ConsensusEngine;
import com.docflow.engine.EngineConfig;
import com.docflow.engine.ExecutionContext;
import com.docflow.engine.ExecutionException;
import com.docflow.engine.FakeVlm;
import com.docflow.engine.StepMetric;
import com.docflow.engine.build.FlowBuilder;
import com.docflow.engine.build.PlannedStep;
import com.docflow.flowdefinition.model.FlowDefinition;
import com.docflow.flowdefinition.model.FlowOrRef;
import com.docflow.flowdefinition.step.ConditionalStep;
import com.docflow.flowdefinition.step.ForEachStep;
import com.docflow.flowdefinition.step.NodeType;
import com.docflow.flowdefinition.step.StandardStep;
import com.docflow.flowdefinition.step.Step;
import com.docflow.flowdefinition.step.StepConfig;
import com.docflow.flowdefinition.step.TriggerStep;
import com.docflow.observability.HookDispatcher;
import com.docflow.observability.TraceContext;
import com.docflow.provider.ProviderRegistry;
import com.docflow.resilience.FallbackManager;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompositeStepMetricsTest {

    private static final FlowScope ROOT = FlowScope.root(TraceContext.root(true), FlowBuilder.ROOT_FLOW_ID);

    private static HandlerContext context(SubFlowRunner runner) {
        FallbackManager fallback = FallbackManager.builder().sleeper(ms -> { }).build();
        return new HandlerContext(new ProviderStepInvoker(fallback, new ConsensusEngine()), runner,
                HookDispatcher.noop(), EngineConfig.defaults());
    }

    private static PlannedStep plan(Step step, ProviderRegistry providers,
                                    Map<String, FlowDefinition> subFlows) {
        return new FlowBuilder().build(FlowDefinition.of(step), providers, subFlows).getSteps().get(0);
    }

    private static StepMetric lastMetric(ExecutionContext ctx) {
        List<StepMetric> metrics = ctx.getMetrics();
        return metrics.get(metrics.size() - 1);
    }

    private static FlowDefinition extractFlow(String providerRef) {
        return FlowDefinition.of(StandardStep.of("extract", NodeType.EXTRACT, StepConfig.provider(providerRef)));
    }

    @Test
    void conditional_unmappedLabelRecordsFailedWrapper() {
        ProviderRegistry providers = ProviderRegistry.builder()
                .register("classifier", FakeVlm.constant("classifier", "receipt"))
                .register("vlm", FakeVlm.constant("vlm", "x"))
                .build();
        PlannedStep step = plan(new ConditionalStep("classify", null, StepConfig.provider("classifier"),
                Map.of("invoice", FlowOrRef.inline(extractFlow("vlm")))), providers, null);
        ExecutionContext ctx = new ExecutionContext();

        assertThrows(ExecutionException.class, () -> new ConditionalStepHandler()
                .dispatch(step, "doc", ctx, ROOT, context((flow, input, scope) -> {
                    throw new AssertionError("no branch should run");
                })));

        StepMetric wrapper = lastMetric(ctx);
        assertEquals("classify", wrapper.stepId());
        assertTrue(wrapper.isWrapper());
        assertTrue(wrapper.rollup().failed());
        assertEquals("conditional", wrapper.rollup().type());
        assertTrue(wrapper.rollup().error().contains("No branch for category 'receipt'"));
        assertEquals(0.0, wrapper.costUsd());
    }

    @Test
    void forEach_belowMinimumRecordsFailedWrapperWithItemCount() {
        ProviderRegistry providers = ProviderRegistry.builder()
                .register("splitter", FakeVlm.constant("splitter", List.of("a", "b", "c")))
                .register("vlm", FakeVlm.constant("vlm", "x"))
                .build();
        PlannedStep step = plan(new ForEachStep("fe", null, StepConfig.provider("splitter"),
                FlowOrRef.inline(extractFlow("vlm"))), providers, null);
        ExecutionContext ctx = new ExecutionContext();

        assertThrows(ExecutionException.class, () -> new ForEachStepHandler()
                .dispatch(step, "doc", ctx, ROOT, context((flow, input, scope) -> {
                    throw new IllegalStateException("item " + input + " broke");
                })));

        StepMetric wrapper = lastMetric(ctx);
        assertEquals("fe", wrapper.stepId());
        assertTrue(wrapper.rollup().failed());
        assertEquals("forEach", wrapper.rollup().type());
        assertEquals(3, wrapper.rollup().itemCount());
    }

    @Test
    void forEach_splitterFailureRecordsFailedWrapperWithoutItems() {
        ProviderRegistry providers = ProviderRegistry.builder()
                .register("splitter", FakeVlm.constant("splitter", "not a list"))
                .register("vlm", FakeVlm.constant("vlm", "x"))
                .build();
        PlannedStep step = plan(new ForEachStep("fe", null, StepConfig.provider("splitter"),
                FlowOrRef.inline(extractFlow("vlm"))), providers, null);
        ExecutionContext ctx = new ExecutionContext();

        assertThrows(ExecutionException.class, () -> new ForEachStepHandler()
                .dispatch(step, "doc", ctx, ROOT, context((flow, input, scope) -> null)));

        StepMetric wrapper = lastMetric(ctx);
        assertTrue(wrapper.rollup().failed());
        assertEquals(0, wrapper.rollup().itemCount());
    }

    @Test
    void trigger_childFailureRecordsFailedWrapper() {
        ProviderRegistry providers = ProviderRegistry.builder().register("vlm", FakeVlm.constant("vlm", "x")).build();
        PlannedStep step = plan(TriggerStep.of("run-child", "child"), providers,
                Map.of("child", extractFlow("vlm")));
        ExecutionContext ctx = new ExecutionContext();

        ExecutionException e = assertThrows(ExecutionException.class, () -> new TriggerStepHandler()
                .dispatch(step, "doc", ctx, ROOT, context((flow, input, scope) -> {
                    throw new ExecutionException("extract", scope.flowPath(), "child exploded", null);
                })));

        assertEquals("extract", e.getStepId());
        assertEquals(1, ctx.getMetrics().size());
        StepMetric wrapper = lastMetric(ctx);
        assertEquals("run-child", wrapper.stepId());
        assertEquals("trigger", wrapper.rollup().type());
        assertTrue(wrapper.rollup().error().contains("child exploded"));
    }
}
