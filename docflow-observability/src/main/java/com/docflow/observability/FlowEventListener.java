package com.docflow.observability;

import com.docflow.observability.event.BatchEndEvent;
import com.docflow.observability.event.BatchItemEndEvent;
import com.docflow.observability.event.BatchStartEvent;
import com.docflow.observability.event.CircuitBreakerTriggeredEvent;
import com.docflow.observability.event.ConsensusCompleteEvent;
import com.docflow.observability.event.ConsensusRunCompleteEvent;
import com.docflow.observability.event.ConsensusStartEvent;
import com.docflow.observability.event.FlowEndEvent;
import com.docflow.observability.event.FlowErrorEvent;
import com.docflow.observability.event.FlowStartEvent;
import com.docflow.observability.event.ProviderRequestEvent;
import com.docflow.observability.event.ProviderResponseEvent;
import com.docflow.observability.event.ProviderRetryEvent;
import com.docflow.observability.event.StepEndEvent;
import com.docflow.observability.event.StepErrorEvent;
import com.docflow.observability.event.StepStartEvent;

/**
 * Lifecycle callbacks emitted by the flow executor, the resilience layer and the consensus engine.
 * Every method is a no-op by default.
 * <p>
 * Listeners are observers: a listener that throws is reported to the {@link HookErrorHandler} and
 * execution continues unchanged. Batch item and consensus events can arrive from worker threads,
 * so implementations must be thread-safe.
 */
public interface FlowEventListener {

    default void onFlowStart(FlowStartEvent event) {
    }

    default void onFlowEnd(FlowEndEvent event) {
    }

    default void onFlowError(FlowErrorEvent event) {
    }

    default void onStepStart(StepStartEvent event) {
    }

    default void onStepEnd(StepEndEvent event) {
    }

    default void onStepError(StepErrorEvent event) {
    }

    default void onProviderRequest(ProviderRequestEvent event) {
    }

    default void onProviderResponse(ProviderResponseEvent event) {
    }

    default void onProviderRetry(ProviderRetryEvent event) {
    }

    default void onCircuitBreakerTriggered(CircuitBreakerTriggeredEvent event) {
    }

    default void onConsensusStart(ConsensusStartEvent event) {
    }

    default void onConsensusRunComplete(ConsensusRunCompleteEvent event) {
    }

    default void onConsensusComplete(ConsensusCompleteEvent event) {
    }

    default void onBatchStart(BatchStartEvent event) {
    }

    default void onBatchItemEnd(BatchItemEndEvent event) {
    }

    default void onBatchEnd(BatchEndEvent event) {
    }
}
