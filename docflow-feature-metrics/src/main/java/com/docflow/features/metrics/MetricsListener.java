package com.docflow.features.metrics;

import com.docflow.observability.FlowEventListener;
import com.docflow.observability.event.BatchEndEvent;
import com.docflow.observability.event.CircuitBreakerTriggeredEvent;
import com.docflow.observability.event.ConsensusCompleteEvent;
import com.docflow.observability.event.FlowEndEvent;
import com.docflow.observability.event.FlowErrorEvent;
import com.docflow.observability.event.ProviderResponseEvent;
import com.docflow.observability.event.ProviderRetryEvent;
import com.docflow.observability.event.StepEndEvent;
import com.docflow.observability.event.StepErrorEvent;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

/**
 * Flow event listener that records Micrometer metrics: flow and step executions and durations,
 * provider token usage and cost, retries, breaker trips, consensus agreement and batch outcomes.
 * <p>
 * Provider meters are tagged with the provider key ({@code vendor:model}). Model names can be dynamic,
 * so the tag can be turned off with {@link #MetricsListener(MeterRegistry, boolean)}.
 */
public final class MetricsListener implements FlowEventListener {

    private final MeterRegistry registry;
    private final boolean includeProviderTag;

    public MetricsListener() {
        this(new SimpleMeterRegistry(), true);
    }

    public MetricsListener(MeterRegistry registry) {
        this(registry, true);
    }

    public MetricsListener(MeterRegistry registry, boolean includeProviderTag) {
        this.registry = registry != null ? registry : new SimpleMeterRegistry();
        this.includeProviderTag = includeProviderTag;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void onFlowEnd(FlowEndEvent event) {
        String flowId = nullToUnknown(event.flowId());
        registry.counter("docflow.flow.executions", "flow", flowId, "success", "true").increment();
        Timer.builder("docflow.flow.duration")
                .tag("flow", flowId)
                .register(registry)
                .record(event.durationMs(), TimeUnit.MILLISECONDS);
        if (event.totalCostUsd() > 0) {
            registry.counter("docflow.flow.cost_usd", "flow", flowId).increment(event.totalCostUsd());
        }
    }

    @Override
    public void onFlowError(FlowErrorEvent event) {
        registry.counter("docflow.flow.executions", "flow", nullToUnknown(event.flowId()), "success", "false")
                .increment();
    }

    @Override
    public void onStepEnd(StepEndEvent event) {
        recordStep(event.stepType(), true, event.durationMs());
    }

    @Override
    public void onStepError(StepErrorEvent event) {
        recordStep(event.stepType(), false, event.durationMs());
    }

    private void recordStep(String stepType, boolean success, long durationMs) {
        String type = nullToUnknown(stepType);
        registry.counter("docflow.step.executions", "stepType", type, "success", String.valueOf(success)).increment();
        Timer.builder("docflow.step.duration")
                .tag("stepType", type)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void onProviderResponse(ProviderResponseEvent event) {
        String provider = providerTag(event.providerKey());
        Timer.builder("docflow.provider.request")
                .tag("provider", provider)
                .register(registry)
                .record(event.durationMs(), TimeUnit.MILLISECONDS);
        if (event.tokensIn() > 0) {
            registry.counter("docflow.provider.tokens_in", "provider", provider).increment(event.tokensIn());
        }
        if (event.tokensOut() > 0) {
            registry.counter("docflow.provider.tokens_out", "provider", provider).increment(event.tokensOut());
        }
        if (event.costUsd() > 0) {
            registry.counter("docflow.provider.cost_usd", "provider", provider).increment(event.costUsd());
        }
    }

    @Override
    public void onProviderRetry(ProviderRetryEvent event) {
        registry.counter("docflow.provider.retries", "provider", providerTag(event.providerKey())).increment();
    }

    @Override
    public void onCircuitBreakerTriggered(CircuitBreakerTriggeredEvent event) {
        registry.counter("docflow.circuit_breaker.triggered", "provider", providerTag(event.providerKey()))
                .increment();
    }

    @Override
    public void onConsensusComplete(ConsensusCompleteEvent event) {
        DistributionSummary.builder("docflow.consensus.agreement")
                .register(registry)
                .record(event.agreement());
        if (event.tieBreakerUsed()) {
            registry.counter("docflow.consensus.ties").increment();
        }
    }

    @Override
    public void onBatchEnd(BatchEndEvent event) {
        registry.counter("docflow.batch.items", "success", "true").increment(event.successfulItems());
        registry.counter("docflow.batch.items", "success", "false").increment(event.failedItems());
    }

    private String providerTag(String providerKey) {
        return includeProviderTag ? nullToUnknown(providerKey) : "all";
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}
