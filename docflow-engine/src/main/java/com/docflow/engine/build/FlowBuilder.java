package com.docflow.engine.build;

import com.docflow.engine.EngineConfig;
import com.docflow.flowdefinition.consensus.ConsensusConfig;
import com.docflow.flowdefinition.model.FlowDefinition;
import com.docflow.flowdefinition.model.FlowOrRef;
import com.docflow.flowdefinition.step.ConditionalStep;
import com.docflow.flowdefinition.step.ForEachStep;
import com.docflow.flowdefinition.step.NodeType;
import com.docflow.flowdefinition.step.OutputStep;
import com.docflow.flowdefinition.step.OutputTransform;
import com.docflow.flowdefinition.step.StandardStep;
import com.docflow.flowdefinition.step.Step;
import com.docflow.flowdefinition.step.StepConfig;
import com.docflow.flowdefinition.step.TriggerStep;
import com.docflow.provider.OcrProvider;
import com.docflow.provider.ProviderInstance;
import com.docflow.provider.ProviderRegistry;
import com.docflow.provider.VlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a flow definition against a provider registry and a sub-flow registry into an
 * {@link ExecutableFlow}.
 * <p>
 * Validation runs over the whole definition, sub-flows included, and collects every problem before
 * failing: unsupported version, duplicate or missing step ids, unknown node types, missing provider refs,
 * capability mismatches (parse needs OCR, every other provider call needs VLM), invalid consensus,
 * missing sub-flows, missing override targets, circular flow references, nesting deeper than the
 * configured maximum, conditionals without branches, forEach without item flow, and output steps
 * reading unknown steps or picking without fields.
 */
public final class FlowBuilder {

    private static final Logger log = LoggerFactory.getLogger(FlowBuilder.class);

    public static final String ROOT_FLOW_ID = "root";

    private final int maxFlowDepth;

    public FlowBuilder() {
        this(EngineConfig.DEFAULT_MAX_FLOW_DEPTH);
    }

    public FlowBuilder(int maxFlowDepth) {
        this.maxFlowDepth = Math.max(1, maxFlowDepth);
    }

    /**
     * @param subFlows flows that triggers and {@code flowRef} branches/item flows may name; may be null
     * @throws BuildException listing every validation error
     */
    public ExecutableFlow build(FlowDefinition flow, ProviderRegistry providers, Map<String, FlowDefinition> subFlows) {
        if (flow == null) {
            throw new BuildException(ValidationResult.failure("Flow definition is null"));
        }
        BuildRun run = new BuildRun(providers != null ? providers : ProviderRegistry.empty(),
                subFlows != null ? subFlows : Map.of());
        ExecutableFlow built = run.buildFlow(ROOT_FLOW_ID, flow, run.providers, false, 1);
        if (!run.errors.isEmpty()) {
            log.debug("Flow build failed with {} error(s)", run.errors.size());
            throw new BuildException(ValidationResult.failure(run.errors));
        }
        return built;
    }

    /** State of one build: collected errors and the stack of sub-flow refs being built. */
    private final class BuildRun {
        private final ProviderRegistry providers;
        private final Map<String, FlowDefinition> subFlows;
        private final List<String> errors = new ArrayList<>();
        private final Deque<String> refStack = new ArrayDeque<>();

        BuildRun(ProviderRegistry providers, Map<String, FlowDefinition> subFlows) {
            this.providers = providers;
            this.subFlows = subFlows;
        }

        ExecutableFlow buildFlow(String flowId, FlowDefinition flow, ProviderRegistry registry, boolean inline,
                                 int depth) {
            if (!inline || flow.getVersion() != null) {
                if (!FlowDefinition.SUPPORTED_VERSION.equals(flow.getVersion())) {
                    errors.add("Flow '" + flowId + "': unsupported version '" + flow.getVersion()
                            + "' (expected " + FlowDefinition.SUPPORTED_VERSION + ")");
                }
            }
            if (flow.getSteps().isEmpty()) {
                errors.add("Flow '" + flowId + "' has no steps");
            }
            Set<String> seen = new HashSet<>();
            List<PlannedStep> planned = new ArrayList<>();
            for (Step step : flow.getSteps()) {
                String id = step.getId();
                if (id == null || id.isBlank()) {
                    errors.add("Flow '" + flowId + "': step without id (" + step.getKind() + ")");
                } else if (!seen.add(id)) {
                    errors.add("Flow '" + flowId + "': duplicate step id '" + id + "'");
                }
                planned.add(planStep(flowId, step, seen, registry, depth));
            }
            return new ExecutableFlow(flowId, flow, planned);
        }

        private PlannedStep planStep(String flowId, Step step, Set<String> earlierIds, ProviderRegistry registry,
                                     int depth) {
            String where = "Flow '" + flowId + "' step '" + step.getId() + "'";
            return switch (step.getKind()) {
                case STANDARD -> {
                    StandardStep s = (StandardStep) step;
                    if (s.getNodeType() == NodeType.UNKNOWN) {
                        errors.add(where + ": unknown node type");
                    }
                    yield new PlannedStep(step, resolveChain(where, s.getConfig(), registry, s.getNodeType().requiresOcr()),
                            null, null);
                }
                case CONDITIONAL -> {
                    ConditionalStep s = (ConditionalStep) step;
                    List<ProviderInstance> chain = resolveChain(where, s.getConfig(), registry, false);
                    if (s.getBranches().isEmpty()) {
                        errors.add(where + ": conditional has no branches");
                    }
                    Map<String, ExecutableFlow> branches = new LinkedHashMap<>();
                    for (Map.Entry<String, FlowOrRef> e : s.getBranches().entrySet()) {
                        String childId = flowId + "/" + step.getId() + "[" + e.getKey() + "]";
                        resolveFlow(where + " branch '" + e.getKey() + "'", childId, e.getValue(), registry, depth)
                                .ifPresent(f -> branches.put(e.getKey(), f));
                    }
                    yield new PlannedStep(step, chain, branches, null);
                }
                case FOR_EACH -> {
                    ForEachStep s = (ForEachStep) step;
                    List<ProviderInstance> chain = resolveChain(where, s.getConfig(), registry, false);
                    ExecutableFlow itemFlow = null;
                    if (s.getItemFlow() == null) {
                        errors.add(where + ": forEach has no itemFlow");
                    } else {
                        itemFlow = resolveFlow(where + " itemFlow", flowId + "/" + step.getId() + "[item]",
                                s.getItemFlow(), registry, depth).orElse(null);
                    }
                    yield new PlannedStep(step, chain, null, itemFlow);
                }
                case TRIGGER -> {
                    TriggerStep s = (TriggerStep) step;
                    ProviderRegistry childRegistry = applyOverrides(where, s.getProviderOverrides(), registry);
                    ExecutableFlow target = null;
                    if (s.getFlowRef() == null || s.getFlowRef().isBlank()) {
                        errors.add(where + ": trigger has no flowRef");
                    } else {
                        target = resolveFlow(where, s.getFlowRef(), FlowOrRef.ref(s.getFlowRef()), childRegistry, depth)
                                .orElse(null);
                    }
                    if (s.getTimeoutMs() != null && s.getTimeoutMs() <= 0) {
                        errors.add(where + ": timeoutMs must be positive");
                    }
                    yield new PlannedStep(step, null, null, target);
                }
                case OUTPUT -> {
                    OutputStep s = (OutputStep) step;
                    if (s.getTransform() == OutputTransform.PICK && s.getFields().isEmpty()) {
                        errors.add(where + ": pick transform requires fields");
                    }
                    for (String source : s.getSource()) {
                        if (!earlierIds.contains(source) || source.equals(step.getId())) {
                            errors.add(where + ": source '" + source + "' is not an earlier step");
                        }
                    }
                    yield new PlannedStep(step, null, null, null);
                }
            };
        }

        private List<ProviderInstance> resolveChain(String where, StepConfig config, ProviderRegistry registry,
                                                    boolean requiresOcr) {
            List<ProviderInstance> chain = new ArrayList<>();
            if (config.getProviderRef() == null || config.getProviderRef().isBlank()) {
                errors.add(where + ": providerRef is required");
            }
            for (String ref : config.getProviderChain()) {
                Optional<ProviderInstance> found = registry.find(ref);
                if (found.isEmpty()) {
                    errors.add(where + ": provider '" + ref + "' is not registered");
                    continue;
                }
                ProviderInstance provider = found.get();
                if (requiresOcr && !(provider instanceof OcrProvider)) {
                    errors.add(where + ": provider '" + ref + "' must be an OCR provider");
                } else if (!requiresOcr && !(provider instanceof VlmProvider)) {
                    errors.add(where + ": provider '" + ref + "' must be a VLM provider");
                } else {
                    chain.add(provider);
                }
            }
            ConsensusConfig consensus = config.getConsensus();
            if (consensus != null && consensus.runs() < 1) {
                errors.add(where + ": consensus runs must be at least 1 (got " + consensus.runs() + ")");
            }
            return chain;
        }

        private ProviderRegistry applyOverrides(String where, Map<String, String> overrides, ProviderRegistry registry) {
            if (overrides == null || overrides.isEmpty()) return registry;
            Map<String, String> valid = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : overrides.entrySet()) {
                if (registry.contains(e.getValue())) {
                    valid.put(e.getKey(), e.getValue());
                } else {
                    errors.add(where + ": provider override target '" + e.getValue() + "' for '" + e.getKey()
                            + "' is not registered");
                }
            }
            return registry.withOverrides(valid);
        }

        private Optional<ExecutableFlow> resolveFlow(String where, String childId, FlowOrRef flowOrRef,
                                                     ProviderRegistry registry, int depth) {
            if (depth + 1 > maxFlowDepth) {
                errors.add(where + ": flow nesting exceeds maximum depth " + maxFlowDepth);
                return Optional.empty();
            }
            if (!flowOrRef.isRef()) {
                return Optional.of(buildFlow(childId, flowOrRef.getInline(), registry, true, depth + 1));
            }
            String ref = flowOrRef.getFlowRef();
            FlowDefinition target = subFlows.get(ref);
            if (target == null) {
                errors.add(where + ": sub-flow '" + ref + "' is not registered");
                return Optional.empty();
            }
            if (refStack.contains(ref)) {
                List<String> cycle = new ArrayList<>(refStack);
                Collections.reverse(cycle);
                cycle.add(ref);
                errors.add(where + ": circular flow reference " + String.join(" -> ", cycle));
                return Optional.empty();
            }
            refStack.push(ref);
            try {
                return Optional.of(buildFlow(ref, target, registry, false, depth + 1));
            } finally {
                refStack.pop();
            }
        }
    }
}
