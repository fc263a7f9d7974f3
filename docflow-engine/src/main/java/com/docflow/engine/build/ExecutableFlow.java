package com.docflow.engine.build;

import com.docflow.flowdefinition.model.FlowDefinition;
import com.docflow.flowdefinition.model.InputValidation;

import java.util.List;

/**
 * A flow with every reference resolved: providers bound per step, sub-flows and branches built.
 * Immutable; one instance can serve any number of concurrent runs.
 */
public final class ExecutableFlow {

    private final String id;
    private final FlowDefinition definition;
    private final List<PlannedStep> steps;

    ExecutableFlow(String id, FlowDefinition definition, List<PlannedStep> steps) {
        this.id = id;
        this.definition = definition;
        this.steps = List.copyOf(steps);
    }

    /** {@code root}, a sub-flow registry key, or a path naming where an inline flow is declared. */
    public String getId() {
        return id;
    }

    public FlowDefinition getDefinition() {
        return definition;
    }

    public List<PlannedStep> getSteps() {
        return steps;
    }

    public InputValidation getInputValidation() {
        return definition.getInputValidation();
    }

    @Override
    public String toString() {
        return "ExecutableFlow{id='" + id + "', steps=" + steps.size() + "}";
    }
}
