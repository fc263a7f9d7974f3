package com.docflow.engine;

import com.docflow.engine.build.ExecutableFlow;
import com.docflow.engine.build.FlowBuilder;
import com.docflow.engine.step.ForEachResult;
import com.docflow.engine.step.ItemResult;
import com.docflow.flowdefinition.FlowDefinitionConfig;
import com.docflow.flowdefinition.consensus.ConsensusConfig;
import com.docflow.flowdefinition.mapping.FieldMapping;
import com.docflow.flowdefinition.mapping.InputMapping;
import com.docflow.flowdefinition.model.FlowDefinition;
import com.docflow.flowdefinition.model.FlowOrRef;
import com.docflow.flowdefinition.model.InputValidation;
import com.docflow.flowdefinition.step.ConditionalStep;
import com.docflow.flowdefinition.step.ForEachStep;
import com.docflow.flowdefinition.step.NodeType;
import com.docflow.flowdefinition.step.OutputStep;
import com.docflow.flowdefinition.step.OutputTransform;
import com.docflow.flowdefinition.step.StandardStep;
import com.docflow.flowdefinition.step.StepConfig;
import com.docflow.flowdefinition.step.TriggerStep;
import com.docflow.observability.FlowEventListener;
import com.docflow.observability.HookDispatcher;
import com.docflow.observability.event.FlowEndEvent;
import com.docflow.observability.event.FlowErrorEvent;
import com.docflow.observability.event.FlowStartEvent;
import com.docflow.observability.event.StepEndEvent;
import com.docflow.observability.event.StepErrorEvent;
import com.docflow.observability.event.StepStartEvent;
import com.docflow.provider.ProviderException;
import com.docflow.provider.ProviderRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowExecutorTest {

    private final List<Long> sleeps = Collections.synchronizedList(new ArrayList<>());

    private FlowExecutor executor() {
        return FlowExecutor.builder().sleeper(sleeps::add).build();
    }

    private static StandardStep extract(String id, String providerRef) {
        return StandardStep.of(id, NodeType.EXTRACT, StepConfig.provider(providerRef));
    }

    private static ExecutableFlow build(FlowDefinition flow, ProviderRegistry providers) {
        return new FlowBuilder().build(flow, providers, null);
    }

    private static List<String> metricIds(FlowResult result) {
        return result.metrics().stream().map(StepMetric::stepId).collect(Collectors.toList());
    }

    @Test
    void steps_runInOrderPassingOutputsAlong() {
        FakeOcr ocr = new FakeOcr("ocr", doc -> "text of " + doc);
        FakeVlm vlm = FakeVlm.answering("vlm", (request, call) -> Map.of("source", request.input(), "total", 42));
        ProviderRegistry providers = ProviderRegistry.builder().register("ocr", ocr).register("vlm", vlm).build();
        FlowDefinition flow = FlowDefinition.of(
                StandardStep.of("parse", NodeType.PARSE, StepConfig.provider("ocr")),
                StandardStep.of("extract", NodeType.EXTRACT,
                        StepConfig.provider("vlm").withSchema(Map.of("type", "object"))));

        FlowResult result = executor().execute(build(flow, providers), "invoice.pdf");

        assertEquals(Map.of("source", "text of invoice.pdf", "total", 42), result.output());
        assertEquals(List.of("parse", "extract"), new ArrayList<>(result.artifacts().keySet()));
        assertEquals("text of invoice.pdf", result.artifacts().get("parse"));
        assertEquals("extract", vlm.requests().get(0).operation());
        assertEquals(Map.of("type", "object"), vlm.requests().get(0).schema());
        assertEquals(List.of("parse", "extract"), metricIds(result));
        assertEquals(110, result.totalTokensIn());
        assertEquals("vlm:m1", result.metrics().get(1).provider());
        assertEquals(32, result.traceId().length());
        assertTrue(result.outputs().isEmpty());
    }

    @Test
    void conditional_runsMappedBranchAgainstStepInput() {
        FakeVlm classifier = FakeVlm.constant("classifier", Map.of("category", "invoice"));
        FakeVlm invoiceExtractor = FakeVlm.answering("invoice", (request, call) -> Map.of("seen", request.input()));
        FakeVlm receiptExtractor = FakeVlm.constant("receipt", Map.of());
        ProviderRegistry providers = ProviderRegistry.builder()
                .register("classifier", classifier)
                .register("invoice", invoiceExtractor)
                .register("receipt", receiptExtractor)
                .build();
        ConditionalStep classify = new ConditionalStep("classify", null,
                StepConfig.provider("classifier").withCategories(List.of("invoice", "receipt")), Map.of(
                "invoice", FlowOrRef.inline(FlowDefinition.of(extract("extract", "invoice"))),
                "receipt", FlowOrRef.inline(FlowDefinition.of(extract("extract", "receipt")))));

        FlowResult result = executor().execute(build(FlowDefinition.of(classify), providers), "doc-1");

        assertEquals(Map.of("seen", "doc-1"), result.output());
        assertEquals("invoice", result.artifacts().get("classify:category"));
        assertEquals(Map.of("extract", Map.of("seen", "doc-1")), result.artifacts().get("classify:branchArtifacts"));
        assertEquals("categorize", classifier.requests().get(0).operation());
        assertEquals(List.of("invoice", "receipt"), classifier.requests().get(0).categories());
        assertEquals(0, receiptExtractor.calls());
        assertTrue(metricIds(result).contains("classify.branch.invoice.extract"));
        assertTrue(result.metrics().stream().filter(m -> m.stepId().startsWith("classify.")).allMatch(StepMetric::nested));
    }

    @Test
    void conditional_unmappedLabelFailsWithoutRunningABranch() {
        FakeVlm classifier = FakeVlm.constant("classifier", "receipt");
        FakeVlm invoiceExtractor = FakeVlm.constant("invoice", Map.of());
        ProviderRegistry providers = ProviderRegistry.builder()
                .register("classifier", classifier)
                .register("invoice", invoiceExtractor)
                .build();
        ConditionalStep classify = new ConditionalStep("classify", null, StepConfig.provider("classifier"),
                Map.of("invoice", FlowOrRef.inline(FlowDefinition.of(extract("extract", "invoice")))));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> executor().execute(build(FlowDefinition.of(classify), providers), "doc"));

        assertEquals("classify", e.getStepId());
        assertTrue(e.getMessage().contains("'receipt'"));
        assertEquals(0, invoiceExtractor.calls());
    }

    @Test
    void forEach_recordsItemFailuresAndKeepsInputOrder() {
        FakeVlm splitter = FakeVlm.constant("splitter", List.of("a", "b", "c"));
        FakeVlm itemExtractor = FakeVlm.answering("item", (request, call) -> {
            if ("b".equals(request.input())) throw new ProviderException("Invalid document", 400);
            return Map.of("item", request.input());
        });
        ProviderRegistry providers = ProviderRegistry.builder()
                .register("splitter", splitter)
                .register("item", itemExtractor)
                .build();
        ForEachStep fe = new ForEachStep("fe", null, StepConfig.provider("splitter"),
                FlowOrRef.inline(FlowDefinition.of(extract("extract", "item"))));

        FlowResult result = executor().execute(build(FlowDefinition.of(fe), providers), "bundle.pdf");

        ForEachResult aggregate = (ForEachResult) result.output();
        assertEquals(3, aggregate.totalItems());
        assertEquals(2, aggregate.successfulItems());
        assertEquals(1, aggregate.failedItems());
        List<ItemResult> items = aggregate.items();
        assertEquals(List.of(0, 1, 2), items.stream().map(ItemResult::index).collect(Collectors.toList()));
        assertEquals(ItemResult.Status.SUCCESS, items.get(0).status());
        assertEquals(ItemResult.Status.FAILED, items.get(1).status());
        assertTrue(items.get(1).error().contains("Invalid document"));
        assertEquals(Map.of("item", "c"), items.get(2).output());
        assertEquals(List.of(Map.of("item", "a"), Map.of("item", "c")), aggregate.successfulOutputs());
        assertTrue(metricIds(result).contains("fe.item[0].extract"));
        assertTrue(metricIds(result).contains("fe.item[2].extract"));
    }

    @Test
    void forEach_failsWhenNoItemSucceeds() {
        FakeVlm splitter = FakeVlm.constant("splitter", Map.of("items", List.of(Map.of("input", "x"))));
        FakeVlm itemExtractor = FakeVlm.answering("item", (request, call) -> {
            throw new ProviderException("Invalid document", 422);
        });
        ProviderRegistry providers = ProviderRegistry.builder()
                .register("splitter", splitter)
                .register("item", itemExtractor)
                .build();
        ForEachStep fe = new ForEachStep("fe", null, StepConfig.provider("splitter"),
                FlowOrRef.inline(FlowDefinition.of(extract("extract", "item"))));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> executor().execute(build(FlowDefinition.of(fe), providers), "doc"));

        assertEquals("fe", e.getStepId());
        assertTrue(e.getMessage().contains("0 of 1 items succeeded"));
        assertEquals("x", itemExtractor.requests().get(0).input());
    }

    @Test
    void forEach_withNoItemsSucceedsEmpty() {
        ProviderRegistry providers = ProviderRegistry.builder()
                .register("splitter", FakeVlm.constant("splitter", List.of()))
                .register("item", FakeVlm.constant("item", "never"))
                .build();
        ForEachStep fe = new ForEachStep("fe", null, StepConfig.provider("splitter"),
                FlowOrRef.inline(FlowDefinition.of(extract("extract", "item"))));

        ForEachResult aggregate = (ForEachResult) executor().execute(build(FlowDefinition.of(fe), providers), "doc")
                .output();

        assertEquals(0, aggregate.totalItems());
        assertEquals(0, aggregate.failedItems());
    }

    @Test
    void fallback_movesToSecondProviderAfterRetriesAreExhausted() {
        FakeVlm primary = FakeVlm.answering("a", (request, call) -> {
            throw new ProviderException("Service unavailable", 503);
        });
        FakeVlm secondary = FakeVlm.constant("b", Map.of("ok", true));
        ProviderRegistry providers = ProviderRegistry.builder().register("a", primary).register("b", secondary).build();
        FlowDefinition flow = FlowDefinition.of(StandardStep.of("extract", NodeType.EXTRACT,
                StepConfig.provider("a").withFallbacks(List.of("b"))));
        FlowExecutor executor = FlowExecutor.builder()
                .config(EngineConfig.builder().maxRetries(1).build())
                .sleeper(sleeps::add)
                .build();

        FlowResult result = executor.execute(build(flow, providers), "doc");

        assertEquals(Map.of("ok", true), result.output());
        assertEquals(2, primary.calls());
        assertEquals(1, secondary.calls());
        assertEquals(1, sleeps.size());
        assertEquals("b:m1", result.metrics().get(0).provider());
        assertEquals(1, executor.getCircuitBreakers().find("a:m1").orElseThrow().getConsecutiveFailures());
    }

    @Test
    void consensusStep_votesAndSumsUsageOverRuns() {
        FakeVlm vlm = FakeVlm.answering("vlm", (request, call) -> call <= 2 ? Map.of("total", 10) : Map.of("total", 11));
        ProviderRegistry providers = ProviderRegistry.builder().register("vlm", vlm).build();
        FlowDefinition flow = FlowDefinition.of(StandardStep.of("extract", NodeType.EXTRACT,
                StepConfig.provider("vlm").withConsensus(ConsensusConfig.majority(3))));

        FlowResult result = executor().execute(build(flow, providers), "doc");

        assertEquals(Map.of("total", 10), result.output());
        assertEquals(3, vlm.calls());
        assertEquals(30, result.metrics().get(0).tokensIn());
    }

    @Test
    void trigger_mapsInputAppliesOverridesAndMergesMetrics() {
        FakeVlm vlm = FakeVlm.answering("vlm", (request, call) -> call == 1
                ? Map.of("text", "hello", "pages", 2)
                : Map.of("child", request.input()));
        ProviderRegistry providers = ProviderRegistry.builder().register("vlm", vlm).build();
        Map<String, FlowDefinition> subFlows = Map.of("child", FlowDefinition.of(extract("inner", "childVlm")));
        Map<String, FieldMapping> fields = new LinkedHashMap<>();
        fields.put("doc", FieldMapping.input("text"));
        fields.put("pages", FieldMapping.artifact("first.pages"));
        fields.put("kind", FieldMapping.literal("invoice"));
        FlowDefinition flow = FlowDefinition.of(
                extract("first", "vlm"),
                new TriggerStep("run-child", null, "child", Map.of("childVlm", "vlm"),
                        InputMapping.construct(fields), null, null));

        FlowResult result = executor().execute(new FlowBuilder().build(flow, providers, subFlows), "doc");

        Map<String, Object> expectedInput = Map.of("doc", "hello", "pages", 2, "kind", "invoice");
        assertEquals(expectedInput, vlm.requests().get(1).input());
        assertEquals(Map.of("child", expectedInput), result.output());
        assertTrue(metricIds(result).contains("run-child"));
        assertTrue(metricIds(result).contains("run-child.inner"));
    }

    @Test
    void trigger_timesOutAndAbandonsChild() {
        FakeVlm slow = FakeVlm.answering("slow", (request, call) -> {
            Thread.sleep(1000);
            return "late";
        });
        ProviderRegistry providers = ProviderRegistry.builder().register("slow", slow).build();
        Map<String, FlowDefinition> subFlows = Map.of("child", FlowDefinition.of(extract("inner", "slow")));
        FlowDefinition flow = FlowDefinition.of(new TriggerStep("run-child", null, "child", null, null, null, 50L));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> executor().execute(new FlowBuilder().build(flow, providers, subFlows), "doc"));

        assertEquals("run-child", e.getStepId());
        assertTrue(e.getMessage().contains("Flow execution timeout after 50ms"));
    }

    @Test
    void nestedFailure_namesInnerStepAndEnclosingPath() {
        FakeVlm broken = FakeVlm.answering("broken", (request, call) -> {
            throw new ProviderException("Bad request", 400);
        });
        ProviderRegistry providers = ProviderRegistry.builder().register("broken", broken).build();
        Map<String, FlowDefinition> subFlows = Map.of("child", FlowDefinition.of(extract("inner", "broken")));
        FlowDefinition flow = FlowDefinition.of(TriggerStep.of("run-child", "child"));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> executor().execute(new FlowBuilder().build(flow, providers, subFlows), "doc"));

        assertEquals("inner", e.getStepId());
        assertEquals(List.of("run-child"), e.getFlowPath());
        assertTrue(e.getMessage().contains("run-child > inner"));
    }

    @Test
    void outputSteps_recordNamedOutputsAndPassInputThrough() {
        FakeVlm first = FakeVlm.constant("first", Map.of("a", 1, "b", 2));
        FakeVlm second = FakeVlm.answering("second", (request, call) -> Map.of("c", 3, "input", request.input()));
        ProviderRegistry providers = ProviderRegistry.builder().register("first", first).register("second", second).build();
        FlowDefinition flow = FlowDefinition.of(
                extract("e1", "first"),
                new OutputStep("picked", null, List.of("e1"), OutputTransform.PICK, List.of("a")),
                extract("e2", "second"),
                new OutputStep("merged", "summary", List.of("e1", "e2"), OutputTransform.MERGE, null));

        FlowResult result = executor().execute(build(flow, providers), "doc");

        assertEquals(Map.of("a", 1, "b", 2), second.requests().get(0).input());
        assertEquals(Map.of("a", 1), result.outputs().get("picked"));
        Map<?, ?> merged = (Map<?, ?>) result.outputs().get("summary");
        assertEquals(Map.of("a", 1, "b", 2, "c", 3, "input", Map.of("a", 1, "b", 2)), merged);
        assertEquals(merged, result.output());
        assertEquals(merged, result.artifacts().get("merged"));
        assertEquals(List.of("picked", "summary"), new ArrayList<>(result.outputs().keySet()));
    }

    @Test
    void inputValidation_rejectsUnacceptedFormatBeforeFirstStep() {
        FakeVlm vlm = FakeVlm.constant("vlm", "x");
        ProviderRegistry providers = ProviderRegistry.builder().register("vlm", vlm).build();
        FlowDefinition strict = FlowDefinition.of(extract("extract", "vlm"))
                .withInputValidation(new InputValidation(List.of("application/pdf"), true));
        FlowDefinition lenient = FlowDefinition.of(extract("extract", "vlm"))
                .withInputValidation(new InputValidation(List.of("application/pdf"), false));
        FlowExecutor executor = executor();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> executor.execute(build(strict, providers), new FlowInput("img", "image/png")));
        assertEquals(FlowExecutor.INPUT_STEP_ID, e.getStepId());
        assertEquals(0, vlm.calls());

        assertEquals("x", executor.execute(build(lenient, providers), new FlowInput("img", "image/png")).output());
        assertEquals("x", executor.execute(build(strict, providers), new FlowInput("doc", "application/pdf")).output());
    }

    @Test
    void hooks_seeFlowAndStepLifecycleInOrder() {
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        FlowEventListener listener = new FlowEventListener() {
            @Override
            public void onFlowStart(FlowStartEvent event) {
                events.add("flowStart:" + event.stepCount());
            }

            @Override
            public void onFlowEnd(FlowEndEvent event) {
                events.add("flowEnd:" + event.totalTokensIn());
            }

            @Override
            public void onFlowError(FlowErrorEvent event) {
                events.add("flowError:" + event.failedStepId());
            }

            @Override
            public void onStepStart(StepStartEvent event) {
                events.add("stepStart:" + event.stepId() + ":" + event.stepType());
            }

            @Override
            public void onStepEnd(StepEndEvent event) {
                events.add("stepEnd:" + event.stepId());
            }

            @Override
            public void onStepError(StepErrorEvent event) {
                events.add("stepError:" + event.stepId());
            }
        };
        ProviderRegistry providers = ProviderRegistry.builder()
                .register("ocr", new FakeOcr("ocr", doc -> "text"))
                .register("vlm", FakeVlm.constant("vlm", Map.of()))
                .register("broken", FakeVlm.answering("broken", (request, call) -> {
                    throw new ProviderException("Unauthorized", 401);
                }))
                .build();
        FlowExecutor executor = FlowExecutor.builder().listener(listener).sleeper(sleeps::add).build();

        executor.execute(build(FlowDefinition.of(
                StandardStep.of("parse", NodeType.PARSE, StepConfig.provider("ocr")),
                extract("extract", "vlm")), providers), "doc");
        assertEquals(List.of("flowStart:2", "stepStart:parse:parse", "stepEnd:parse", "stepStart:extract:extract",
                "stepEnd:extract", "flowEnd:110"), events);

        events.clear();
        assertThrows(ExecutionException.class,
                () -> executor.execute(build(FlowDefinition.of(extract("bad", "broken")), providers), "doc"));
        assertEquals(List.of("flowStart:1", "stepStart:bad:extract", "stepError:bad", "flowError:bad"), events);
    }

    @Test
    void builtFlow_canRunRepeatedlyWithIsolatedContexts() {
        FakeVlm vlm = FakeVlm.answering("vlm", (request, call) -> "run-" + call);
        ProviderRegistry providers = ProviderRegistry.builder().register("vlm", vlm).build();
        ExecutableFlow flow = build(FlowDefinition.of(extract("extract", "vlm")), providers);
        FlowExecutor executor = executor();

        FlowResult first = executor.execute(flow, "doc");
        FlowResult second = executor.execute(flow, "doc");

        assertEquals("run-1", first.output());
        assertEquals("run-2", second.output());
        assertFalse(first.traceId().equals(second.traceId()));
        assertNull(first.outputs().get("extract"));
    }

    @Test
    void jsonFlow_routesThroughRegisteredSubFlow() throws IOException {
        FlowDefinition flow;
        try (InputStream in = getClass().getResourceAsStream("/flows/intake.json")) {
            flow = FlowDefinitionConfig.fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        FakeVlm vlm = FakeVlm.answering("vlm", (request, call) -> "categorize".equals(request.operation())
                ? Map.of("category", "receipt")
                : Map.of("total", 12.5, "vendor", "cafe"));
        ProviderRegistry providers = ProviderRegistry.builder()
                .register("ocr", new FakeOcr("ocr", doc -> "scanned " + doc))
                .register("vlm", vlm)
                .build();
        Map<String, FlowDefinition> subFlows = Map.of("receipt-flow", FlowDefinition.of(extract("extract", "vlm")));

        FlowResult result = executor().execute(new FlowBuilder().build(flow, providers, subFlows),
                new FlowInput("receipt.pdf", "application/pdf"));

        assertEquals(Map.of("total", 12.5), result.output());
        assertEquals(Map.of("total", 12.5), result.outputs().get("fields"));
        assertEquals(List.of("invoice", "receipt"), vlm.requests().get(0).categories());
        assertEquals("scanned receipt.pdf", vlm.requests().get(1).input());
        assertTrue(metricIds(result).contains("route.branch.receipt.extract"));
    }

    @Test
    void compositeSteps_recordWrapperMetricsThatRollUpChildren() {
        FakeVlm vlm = FakeVlm.answering("vlm", (request, call) -> {
            switch (request.operation()) {
                case "categorize":
                    return "invoice";
                case "split":
                    return List.of("a", "b");
                default:
                    return Map.of("seen", request.input());
            }
        });
        ProviderRegistry providers = ProviderRegistry.builder().register("vlm", vlm).build();
        FlowDefinition flow = FlowDefinition.of(
                new ConditionalStep("cond", null, StepConfig.provider("vlm"),
                        Map.of("invoice", FlowOrRef.inline(FlowDefinition.of(extract("extract", "vlm"))))),
                new ForEachStep("fe", null, StepConfig.provider("vlm"),
                        FlowOrRef.inline(FlowDefinition.of(extract("extract", "vlm")))));

        FlowResult result = executor().execute(build(flow, providers), "doc");

        List<StepMetric> wrappers = result.metrics().stream().filter(StepMetric::isWrapper)
                .collect(Collectors.toList());
        assertEquals(List.of("cond", "fe"), wrappers.stream().map(StepMetric::stepId).collect(Collectors.toList()));

        StepMetric cond = wrappers.get(0);
        assertEquals("conditional", cond.rollup().type());
        assertEquals(0.02, cond.costUsd(), 1e-9);
        assertEquals("vlm:m1", cond.provider());
        assertFalse(cond.rollup().failed());

        StepMetric fe = wrappers.get(1);
        assertEquals("forEach", fe.rollup().type());
        assertEquals(0.03, fe.costUsd(), 1e-9);
        assertEquals(2, fe.rollup().itemCount());
        assertEquals(2, fe.rollup().successCount());
        assertEquals(0, fe.rollup().failureCount());
        assertTrue(fe.rollup().overheadMs() >= 0);
        assertTrue(fe.durationMs() >= fe.rollup().overheadMs());

        assertEquals(0.05, result.totalCostUsd(), 1e-9);
        assertEquals(50, result.totalTokensIn());
    }

    @Test
    void forEach_neverRunsMoreItemsAtOnceThanConfigured() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        FakeVlm splitter = FakeVlm.constant("splitter",
                IntStream.range(0, 10).boxed().collect(Collectors.toList()));
        FakeVlm slow = FakeVlm.answering("slow", (request, call) -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(30);
            } finally {
                inFlight.decrementAndGet();
            }
            return request.input();
        });
        ProviderRegistry providers = ProviderRegistry.builder()
                .register("splitter", splitter)
                .register("slow", slow)
                .build();
        ForEachStep fe = new ForEachStep("fe", null, StepConfig.provider("splitter"),
                FlowOrRef.inline(FlowDefinition.of(extract("extract", "slow"))));
        FlowExecutor executor = FlowExecutor.builder()
                .config(EngineConfig.builder().forEachConcurrency(3).build())
                .sleeper(sleeps::add)
                .build();

        ForEachResult aggregate = (ForEachResult) executor.execute(build(FlowDefinition.of(fe), providers), "doc")
                .output();

        assertEquals(10, aggregate.successfulItems());
        assertEquals(10, slow.calls());
        assertTrue(peak.get() <= 3, () -> "peak concurrency " + peak.get());
        assertTrue(peak.get() >= 1);
    }

    @Test
    void close_leavesCallerSuppliedDispatcherOpen() {
        List<String> starts = Collections.synchronizedList(new ArrayList<>());
        HookDispatcher shared = HookDispatcher.builder()
                .listener(new FlowEventListener() {
                    @Override
                    public void onFlowStart(FlowStartEvent event) {
                        starts.add(event.flowId());
                    }
                })
                .fireAndForget(true)
                .build();
        ProviderRegistry providers = ProviderRegistry.builder().register("vlm", FakeVlm.constant("vlm", "ok")).build();
        ExecutableFlow flow = build(FlowDefinition.of(extract("extract", "vlm")), providers);

        try (FlowExecutor first = FlowExecutor.builder().hooks(shared).build()) {
            first.execute(flow, "doc-1");
        }
        try (FlowExecutor second = FlowExecutor.builder().hooks(shared).build()) {
            assertEquals("ok", second.execute(flow, "doc-2").output());
        }
        shared.close();

        assertEquals(2, starts.size());
    }
}
