package com.docflow.engine.build;

import com.docflow.flowdefinition.step.Step;
import com.docflow.flowdefinition.step.StepKind;
import com.docflow.provider.ProviderInstance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One step of an {@link ExecutableFlow}.
 * <p>
 * {@code providers} is the provider chain (primary first) of steps that call providers: standard steps,
 * the classifier of a conditional and the splitter of a forEach. {@code branches} is only set for
 * conditionals, {@code childFlow} for forEach (item flow) and trigger (target flow).
 */
public final class PlannedStep {

    private final Step step;
    private final List<ProviderInstance> providers;
    private final Map<String, ExecutableFlow> branches;
    private final ExecutableFlow childFlow;

    PlannedStep(Step step, List<? extends ProviderInstance> providers, Map<String, ExecutableFlow> branches,
                ExecutableFlow childFlow) {
        this.step = step;
        this.providers = providers != null ? List.copyOf(providers) : List.of();
        this.branches = branches != null ? Collections.unmodifiableMap(new LinkedHashMap<>(branches)) : Map.of();
        this.childFlow = childFlow;
    }

    public Step getStep() {
        return step;
    }

    public String getId() {
        return step.getId();
    }

    public StepKind getKind() {
        return step.getKind();
    }

    public List<ProviderInstance> getProviders() {
        return providers;
    }

    public Map<String, ExecutableFlow> getBranches() {
        return branches;
    }

    public ExecutableFlow getChildFlow() {
        return childFlow;
    }

    public <S extends Step> S as(Class<S> type) {
        return type.cast(step);
    }

    @Override
    public String toString() {
        return "PlannedStep{" + step.getKind() + " '" + step.getId() + "'}";
    }
}
