package com.docflow.engine;

import com.docflow.consensus.ConsensusEngine;
import com.docflow.engine.build.ExecutableFlow;
import com.docflow.engine.build.PlannedStep;
import com.docflow.engine.step.FlowScope;
import com.docflow.engine.step.HandlerContext;
import com.docflow.engine.step.ProviderStepInvoker;
import com.docflow.engine.step.StepHandlerRegistry;
import com.docflow.engine.step.StepOutcome;
import com.docflow.engine.step.SubFlowOutcome;
import com.docflow.flowdefinition.model.InputValidation;
import com.docflow.flowdefinition.step.StandardStep;
import com.docflow.flowdefinition.step.StepKind;
import com.docflow.observability.FlowEventListener;
import com.docflow.observability.HookDispatcher;
import com.docflow.observability.HookErrorHandler;
import com.docflow.observability.TraceContext;
import com.docflow.observability.event.FlowEndEvent;
import com.docflow.observability.event.FlowErrorEvent;
import com.docflow.observability.event.FlowStartEvent;
import com.docflow.observability.event.StepEndEvent;
import com.docflow.observability.event.StepErrorEvent;
import com.docflow.observability.event.StepStartEvent;
import com.docflow.resilience.FallbackManager;
import com.docflow.resilience.Sleeper;
import com.docflow.resilience.breaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Runs built flows. Steps run strictly in order; each step's artifact is committed before the next starts.
 * <p>
 * One executor can run many flows; each run gets its own {@link ExecutionContext} and trace. Circuit
 * breaker state lives in the fallback manager and is shared by every run of this executor.
 */
public final class FlowExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FlowExecutor.class);

    static final String INPUT_STEP_ID = "<input>";

    private final EngineConfig config;
    private final HookDispatcher hooks;
    private final boolean ownsHooks;
    private final FallbackManager fallbackManager;
    private final StepHandlerRegistry handlers;
    private final HandlerContext handlerContext;

    private FlowExecutor(Builder b) {
        this.config = b.config != null ? b.config : EngineConfig.defaults();
        this.ownsHooks = b.hooks == null;
        this.hooks = b.hooks != null ? b.hooks : HookDispatcher.builder()
                .listeners(b.listeners)
                .errorHandler(b.errorHandler)
                .fireAndForget(config.isHooksFireAndForget())
                .samplingRate(config.getHookSamplingRate())
                .build();
        this.fallbackManager = b.fallbackManager != null ? b.fallbackManager : FallbackManager.builder()
                .policy(config.toRetryPolicy())
                .circuitBreakers(b.circuitBreakers != null ? b.circuitBreakers : config.toCircuitBreakerRegistry())
                .hooks(hooks)
                .sleeper(b.sleeper)
                .build();
        ConsensusEngine consensus = b.consensusEngine != null
                ? b.consensusEngine
                : new ConsensusEngine(hooks, b.random != null ? b.random : new Random());
        this.handlers = b.handlers != null ? b.handlers : StepHandlerRegistry.defaults();
        this.handlerContext = new HandlerContext(new ProviderStepInvoker(fallbackManager, consensus),
                this::runSubFlow, hooks, config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public EngineConfig getConfig() {
        return config;
    }

    public HookDispatcher getHooks() {
        return hooks;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return fallbackManager.getCircuitBreakers();
    }

    public FlowResult execute(ExecutableFlow flow, Object document) {
        return execute(flow, FlowInput.of(document));
    }

    /**
     * @throws ExecutionException naming the first step that failed
     */
    public FlowResult execute(ExecutableFlow flow, FlowInput input) {
        Objects.requireNonNull(flow, "flow");
        FlowInput flowInput = input != null ? input : FlowInput.of(null);
        TraceContext trace = hooks.startTrace();
        long start = System.currentTimeMillis();
        hooks.onFlowStart(new FlowStartEvent(trace, flow.getId(), flow.getSteps().size(), start));
        ExecutionContext ctx = new ExecutionContext();
        try {
            validateInput(flow, flowInput);
            Object output = runFlow(flow, flowInput.document(), ctx, FlowScope.root(trace, flow.getId()));
            FlowResult result = new FlowResult(output, ctx.getOutputs(), ctx.getArtifacts(), ctx.getMetrics(),
                    trace.traceId());
            hooks.onFlowEnd(new FlowEndEvent(trace, flow.getId(), System.currentTimeMillis() - start, output,
                    result.totalTokensIn(), result.totalTokensOut(), result.totalCostUsd()));
            log.info("Flow {} completed in {} ms ({} steps, trace {})", flow.getId(),
                    System.currentTimeMillis() - start, flow.getSteps().size(), trace.traceId());
            return result;
        } catch (ExecutionException e) {
            hooks.onFlowError(new FlowErrorEvent(trace, flow.getId(), e.getStepId(), e,
                    System.currentTimeMillis() - start));
            log.warn("Flow {} failed at step {}: {}", flow.getId(), e.getStepId(), e.getMessage());
            throw e;
        }
    }

    private void validateInput(ExecutableFlow flow, FlowInput input) {
        InputValidation validation = flow.getInputValidation();
        if (validation == null || validation.acceptedFormats().isEmpty()) return;
        if (validation.accepts(input.mimeType())) return;
        String message = "Unsupported input format '" + input.mimeType() + "' (accepted: "
                + String.join(", ", validation.acceptedFormats()) + ")";
        if (validation.throwOnInvalid()) {
            throw new ExecutionException(INPUT_STEP_ID, List.of(), message, null);
        }
        log.warn("Flow {}: {}; continuing", flow.getId(), message);
    }

    private SubFlowOutcome runSubFlow(ExecutableFlow flow, Object input, FlowScope scope) {
        ExecutionContext child = new ExecutionContext();
        Object output = runFlow(flow, input, child, scope);
        return new SubFlowOutcome(output, child.getArtifacts(), child.getMetrics());
    }

    private Object runFlow(ExecutableFlow flow, Object input, ExecutionContext ctx, FlowScope scope) {
        Object current = input;
        Object lastStepOutput = input;
        Object lastOutputValue = null;
        boolean outputRan = false;
        for (PlannedStep step : flow.getSteps()) {
            TraceContext span = scope.trace().child();
            String stepType = stepType(step);
            hooks.onStepStart(new StepStartEvent(span, step.getId(), stepType, scope.flowPath()));
            long start = System.currentTimeMillis();
            StepOutcome outcome;
            try {
                outcome = handlers.forKind(step.getKind())
                        .dispatch(step, current, ctx, scope.withTrace(span), handlerContext);
                ctx.putArtifact(step.getId(), outcome.artifact());
            } catch (ExecutionException e) {
                hooks.onStepError(new StepErrorEvent(span, step.getId(), stepType, e, System.currentTimeMillis() - start));
                throw e;
            } catch (RuntimeException e) {
                hooks.onStepError(new StepErrorEvent(span, step.getId(), stepType, e, System.currentTimeMillis() - start));
                throw new ExecutionException(step.getId(), scope.flowPath(), e);
            }
            hooks.onStepEnd(new StepEndEvent(span, step.getId(), stepType, System.currentTimeMillis() - start,
                    outcome.artifact()));
            if (step.getKind() == StepKind.OUTPUT) {
                outputRan = true;
                lastOutputValue = outcome.artifact();
            } else {
                lastStepOutput = outcome.next();
            }
            current = outcome.next();
        }
        return outputRan ? lastOutputValue : lastStepOutput;
    }

    static String stepType(PlannedStep step) {
        return switch (step.getKind()) {
            case STANDARD -> step.as(StandardStep.class).getNodeType().toValue();
            case CONDITIONAL -> "conditional";
            case FOR_EACH -> "forEach";
            case TRIGGER -> "trigger";
            case OUTPUT -> "output";
        };
    }

    /** Closes the dispatcher built from the listeners; one passed to {@link Builder#hooks} stays open. */
    @Override
    public void close() {
        if (ownsHooks) {
            hooks.close();
        }
    }

    public static final class Builder {
        private EngineConfig config;
        private HookDispatcher hooks;
        private final List<FlowEventListener> listeners = new ArrayList<>();
        private HookErrorHandler errorHandler;
        private CircuitBreakerRegistry circuitBreakers;
        private Sleeper sleeper;
        private FallbackManager fallbackManager;
        private ConsensusEngine consensusEngine;
        private Random random;
        private StepHandlerRegistry handlers;

        private Builder() {
        }

        public Builder config(EngineConfig value) {
            this.config = value;
            return this;
        }

        /** Use this dispatcher instead of one built from the listeners and config. The caller closes it. */
        public Builder hooks(HookDispatcher value) {
            this.hooks = value;
            return this;
        }

        public Builder listener(FlowEventListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Builder errorHandler(HookErrorHandler value) {
            this.errorHandler = value;
            return this;
        }

        public Builder circuitBreakers(CircuitBreakerRegistry value) {
            this.circuitBreakers = value;
            return this;
        }

        public Builder sleeper(Sleeper value) {
            this.sleeper = value;
            return this;
        }

        public Builder fallbackManager(FallbackManager value) {
            this.fallbackManager = value;
            return this;
        }

        public Builder consensusEngine(ConsensusEngine value) {
            this.consensusEngine = value;
            return this;
        }

        /** Source of randomness for consensus tie-breaks. */
        public Builder random(Random value) {
            this.random = value;
            return this;
        }

        public Builder handlers(StepHandlerRegistry value) {
            this.handlers = value;
            return this;
        }

        public FlowExecutor build() {
            return new FlowExecutor(this);
        }
    }
}
