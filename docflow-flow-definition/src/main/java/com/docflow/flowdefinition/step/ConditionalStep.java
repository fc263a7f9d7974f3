package com.docflow.flowdefinition.step;

import com.docflow.flowdefinition.model.FlowOrRef;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies the input with a categorize call, then runs exactly one branch selected by label.
 * A label without a branch fails the step; there is no default branch.
 */
public final class ConditionalStep implements Step {

    private final String id;
    private final String name;
    private final StepConfig config;
    private final Map<String, FlowOrRef> branches;

    @JsonCreator
    public ConditionalStep(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("config") StepConfig config,
            @JsonProperty("branches") Map<String, FlowOrRef> branches) {
        this.id = id;
        this.name = name;
        this.config = config != null ? config : StepConfig.provider(null);
        this.branches = branches != null ? Collections.unmodifiableMap(new LinkedHashMap<>(branches)) : Map.of();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    @JsonIgnore
    public StepKind getKind() {
        return StepKind.CONDITIONAL;
    }

    /** Classifier binding. */
    public StepConfig getConfig() {
        return config;
    }

    /** Label to branch flow, in declaration order. */
    public Map<String, FlowOrRef> getBranches() {
        return branches;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConditionalStep that = (ConditionalStep) o;
        return Objects.equals(id, that.id) && Objects.equals(name, that.name)
                && Objects.equals(config, that.config) && Objects.equals(branches, that.branches);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, config, branches);
    }

    @Override
    public String toString() {
        return "ConditionalStep{id=" + id + ", branches=" + branches.keySet() + "}";
    }
}
