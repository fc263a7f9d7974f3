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
import com.docflow.observability.event.FlowEvent;
import com.docflow.observability.event.FlowStartEvent;
import com.docflow.observability.event.ProviderRequestEvent;
import com.docflow.observability.event.ProviderResponseEvent;
import com.docflow.observability.event.ProviderRetryEvent;
import com.docflow.observability.event.StepEndEvent;
import com.docflow.observability.event.StepErrorEvent;
import com.docflow.observability.event.StepStartEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;

/**
 * Fans events out to the registered listeners in registration order, isolating their failures.
 * <p>
 * Blocking mode (default) invokes listeners on the calling thread before returning. Fire-and-forget
 * mode hands each event to a single background thread, which keeps event order. Events of an
 * unsampled trace (see {@link #startTrace()}) are dropped here; engine behavior is unaffected.
 */
public final class HookDispatcher implements FlowEventListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HookDispatcher.class);

    private final List<FlowEventListener> listeners;
    private final HookErrorHandler errorHandler;
    private final double samplingRate;
    private final DoubleSupplier random;
    private final ExecutorService asyncExecutor;

    private HookDispatcher(Builder b) {
        this.listeners = List.copyOf(b.listeners);
        this.errorHandler = b.errorHandler != null ? b.errorHandler : HookErrorHandler.logging();
        this.samplingRate = Double.isFinite(b.samplingRate) ? Math.max(0.0, Math.min(1.0, b.samplingRate)) : 1.0;
        this.random = b.random != null ? b.random : () -> ThreadLocalRandom.current().nextDouble();
        this.asyncExecutor = b.fireAndForget && !listeners.isEmpty()
                ? Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "docflow-hooks");
                    t.setDaemon(true);
                    return t;
                })
                : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Dispatcher without listeners; every event is dropped. */
    public static HookDispatcher noop() {
        return builder().build();
    }

    public List<FlowEventListener> getListeners() {
        return listeners;
    }

    public boolean isFireAndForget() {
        return asyncExecutor != null;
    }

    /** Starts a trace for one flow run, deciding sampling once for the whole run. */
    public TraceContext startTrace() {
        boolean sampled = samplingRate >= 1.0 || (samplingRate > 0.0 && random.getAsDouble() < samplingRate);
        return TraceContext.root(sampled);
    }

    @Override
    public void onFlowStart(FlowStartEvent event) {
        fire("onFlowStart", event, l -> l.onFlowStart(event));
    }

    @Override
    public void onFlowEnd(FlowEndEvent event) {
        fire("onFlowEnd", event, l -> l.onFlowEnd(event));
    }

    @Override
    public void onFlowError(FlowErrorEvent event) {
        fire("onFlowError", event, l -> l.onFlowError(event));
    }

    @Override
    public void onStepStart(StepStartEvent event) {
        fire("onStepStart", event, l -> l.onStepStart(event));
    }

    @Override
    public void onStepEnd(StepEndEvent event) {
        fire("onStepEnd", event, l -> l.onStepEnd(event));
    }

    @Override
    public void onStepError(StepErrorEvent event) {
        fire("onStepError", event, l -> l.onStepError(event));
    }

    @Override
    public void onProviderRequest(ProviderRequestEvent event) {
        fire("onProviderRequest", event, l -> l.onProviderRequest(event));
    }

    @Override
    public void onProviderResponse(ProviderResponseEvent event) {
        fire("onProviderResponse", event, l -> l.onProviderResponse(event));
    }

    @Override
    public void onProviderRetry(ProviderRetryEvent event) {
        fire("onProviderRetry", event, l -> l.onProviderRetry(event));
    }

    @Override
    public void onCircuitBreakerTriggered(CircuitBreakerTriggeredEvent event) {
        fire("onCircuitBreakerTriggered", event, l -> l.onCircuitBreakerTriggered(event));
    }

    @Override
    public void onConsensusStart(ConsensusStartEvent event) {
        fire("onConsensusStart", event, l -> l.onConsensusStart(event));
    }

    @Override
    public void onConsensusRunComplete(ConsensusRunCompleteEvent event) {
        fire("onConsensusRunComplete", event, l -> l.onConsensusRunComplete(event));
    }

    @Override
    public void onConsensusComplete(ConsensusCompleteEvent event) {
        fire("onConsensusComplete", event, l -> l.onConsensusComplete(event));
    }

    @Override
    public void onBatchStart(BatchStartEvent event) {
        fire("onBatchStart", event, l -> l.onBatchStart(event));
    }

    @Override
    public void onBatchItemEnd(BatchItemEndEvent event) {
        fire("onBatchItemEnd", event, l -> l.onBatchItemEnd(event));
    }

    @Override
    public void onBatchEnd(BatchEndEvent event) {
        fire("onBatchEnd", event, l -> l.onBatchEnd(event));
    }

    private void fire(String hookName, FlowEvent event, Consumer<FlowEventListener> call) {
        if (listeners.isEmpty()) return;
        if (event.trace() != null && !event.trace().sampled()) return;
        if (asyncExecutor == null) {
            invokeAll(hookName, event, call);
            return;
        }
        try {
            asyncExecutor.execute(() -> invokeAll(hookName, event, call));
        } catch (RejectedExecutionException e) {
            log.warn("Hook {} dropped: dispatcher is closed", hookName);
        }
    }

    private void invokeAll(String hookName, FlowEvent event, Consumer<FlowEventListener> call) {
        for (FlowEventListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (Throwable t) {
                report(hookName, event, t);
            }
        }
    }

    private void report(String hookName, FlowEvent event, Throwable error) {
        String traceId = event.trace() != null ? event.trace().traceId() : null;
        try {
            errorHandler.onHookError(new HookError(hookName, error, System.currentTimeMillis(), traceId));
        } catch (Throwable t) {
            log.warn("Hook error handler failed while reporting {} failure: {}", hookName, t.getMessage(), t);
        }
    }

    /** Drains pending fire-and-forget events (bounded wait) and stops the background thread. */
    @Override
    public void close() {
        if (asyncExecutor == null) return;
        asyncExecutor.shutdown();
        try {
            if (!asyncExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                asyncExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            asyncExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static final class Builder {
        private final List<FlowEventListener> listeners = new ArrayList<>();
        private HookErrorHandler errorHandler;
        private boolean fireAndForget;
        private double samplingRate = 1.0;
        private DoubleSupplier random;

        private Builder() {
        }

        public Builder listener(FlowEventListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Builder listeners(List<? extends FlowEventListener> values) {
            if (values != null) values.forEach(this::listener);
            return this;
        }

        public Builder errorHandler(HookErrorHandler handler) {
            this.errorHandler = handler;
            return this;
        }

        public Builder fireAndForget(boolean value) {
            this.fireAndForget = value;
            return this;
        }

        /** Fraction of runs whose events are delivered, clamped to [0, 1]; NaN or infinite means 1. Default 1. */
        public Builder samplingRate(double value) {
            this.samplingRate = value;
            return this;
        }

        /** Source of uniform [0, 1) values for the sampling decision. */
        public Builder random(DoubleSupplier value) {
            this.random = value;
            return this;
        }

        public HookDispatcher build() {
            return new HookDispatcher(this);
        }
    }
}
