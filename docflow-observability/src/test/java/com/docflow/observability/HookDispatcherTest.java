package com.docflow.observability;

import com.docflow.observability.event.StepEndEvent;
import com.docflow.observability.event.StepStartEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HookDispatcherTest {

    private static StepStartEvent stepStart(TraceContext trace, String stepId) {
        return new StepStartEvent(trace, stepId, "step", List.of());
    }

    @Test
    void failingListener_isReportedAndLaterListenersStillRun() {
        List<String> calls = new ArrayList<>();
        List<HookError> errors = new ArrayList<>();
        HookDispatcher hooks = HookDispatcher.builder()
                .listener(new FlowEventListener() {
                    @Override
                    public void onStepStart(StepStartEvent event) {
                        calls.add("first");
                        throw new IllegalStateException("listener broke");
                    }
                })
                .listener(new FlowEventListener() {
                    @Override
                    public void onStepStart(StepStartEvent event) {
                        calls.add("second");
                    }
                })
                .errorHandler(errors::add)
                .build();
        TraceContext trace = hooks.startTrace();

        assertDoesNotThrow(() -> hooks.onStepStart(stepStart(trace, "extract")));

        assertEquals(List.of("first", "second"), calls);
        assertEquals(1, errors.size());
        assertEquals("onStepStart", errors.get(0).hookName());
        assertEquals("listener broke", errors.get(0).error().getMessage());
        assertEquals(trace.traceId(), errors.get(0).traceId());
    }

    @Test
    void throwingErrorHandler_doesNotPropagate() {
        HookDispatcher hooks = HookDispatcher.builder()
                .listener(new FlowEventListener() {
                    @Override
                    public void onStepEnd(StepEndEvent event) {
                        throw new RuntimeException("boom");
                    }
                })
                .errorHandler(error -> {
                    throw new RuntimeException("handler boom");
                })
                .build();

        assertDoesNotThrow(() -> hooks.onStepEnd(new StepEndEvent(hooks.startTrace(), "s", "step", 1, null)));
    }

    @Test
    void unsampledTrace_skipsListeners() {
        List<String> calls = new ArrayList<>();
        HookDispatcher hooks = HookDispatcher.builder()
                .listener(new FlowEventListener() {
                    @Override
                    public void onStepStart(StepStartEvent event) {
                        calls.add(event.stepId());
                    }
                })
                .samplingRate(0.5)
                .random(() -> 0.9)
                .build();

        TraceContext trace = hooks.startTrace();
        hooks.onStepStart(stepStart(trace, "a"));

        assertFalse(trace.sampled());
        assertTrue(calls.isEmpty());
    }

    @Test
    void samplingDecision_isTakenOncePerTrace() {
        HookDispatcher sampledHalf = HookDispatcher.builder().samplingRate(0.5).random(() -> 0.2).build();
        HookDispatcher never = HookDispatcher.builder().samplingRate(0.0).random(() -> 0.0).build();

        TraceContext trace = sampledHalf.startTrace();

        assertTrue(trace.sampled());
        assertTrue(trace.child().sampled());
        assertFalse(never.startTrace().sampled());
    }

    @Test
    void fireAndForget_deliversInOrderOnBackgroundThread() {
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        List<String> threads = Collections.synchronizedList(new ArrayList<>());
        HookDispatcher hooks = HookDispatcher.builder()
                .listener(new FlowEventListener() {
                    @Override
                    public void onStepStart(StepStartEvent event) {
                        calls.add(event.stepId());
                        threads.add(Thread.currentThread().getName());
                    }
                })
                .fireAndForget(true)
                .build();
        TraceContext trace = hooks.startTrace();

        for (int i = 0; i < 20; i++) {
            hooks.onStepStart(stepStart(trace, "s" + i));
        }
        hooks.close();

        assertTrue(hooks.isFireAndForget());
        assertEquals(20, calls.size());
        for (int i = 0; i < 20; i++) {
            assertEquals("s" + i, calls.get(i));
        }
        assertTrue(threads.stream().allMatch("docflow-hooks"::equals));
    }

    @Test
    void traceContext_usesHexIdsOfFixedLength() {
        TraceContext root = TraceContext.root(true);
        TraceContext child = root.child();

        assertTrue(root.traceId().matches("[0-9a-f]{32}"));
        assertTrue(root.spanId().matches("[0-9a-f]{16}"));
        assertEquals(root.traceId(), child.traceId());
        assertEquals(root.spanId(), child.parentSpanId());
    }

    @Test
    void nanSamplingRate_deliversEveryRun() {
        List<String> calls = new ArrayList<>();
        HookDispatcher hooks = HookDispatcher.builder()
                .listener(new FlowEventListener() {
                    @Override
                    public void onStepStart(StepStartEvent event) {
                        calls.add(event.stepId());
                    }
                })
                .samplingRate(Double.NaN)
                .random(() -> 0.99)
                .build();

        TraceContext trace = hooks.startTrace();
        hooks.onStepStart(stepStart(trace, "a"));

        assertTrue(trace.sampled());
        assertEquals(List.of("a"), calls);
    }

    @Test
    void listeners_areKeptInRegistrationOrder() {
        FlowEventListener first = new FlowEventListener() {
        };
        FlowEventListener second = new FlowEventListener() {
        };

        HookDispatcher hooks = HookDispatcher.builder().listener(first).listener(second).build();

        assertEquals(List.of(first, second), hooks.getListeners());
        assertFalse(hooks.isFireAndForget());
    }
}
