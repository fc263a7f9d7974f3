package com.docflow.flowdefinition.step;

import com.docflow.flowdefinition.model.FlowOrRef;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Splits the input into items with a split call, then runs {@code itemFlow} once per item.
 */
public final class ForEachStep implements Step {

    private final String id;
    private final String name;
    private final StepConfig config;
    private final FlowOrRef itemFlow;

    @JsonCreator
    public ForEachStep(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("config") StepConfig config,
            @JsonProperty("itemFlow") FlowOrRef itemFlow) {
        this.id = id;
        this.name = name;
        this.config = config != null ? config : StepConfig.provider(null);
        this.itemFlow = itemFlow;
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
        return StepKind.FOR_EACH;
    }

    /** Splitter binding. */
    public StepConfig getConfig() {
        return config;
    }

    /** May be null in a malformed definition; the builder reports it. */
    public FlowOrRef getItemFlow() {
        return itemFlow;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ForEachStep that = (ForEachStep) o;
        return Objects.equals(id, that.id) && Objects.equals(name, that.name)
                && Objects.equals(config, that.config) && Objects.equals(itemFlow, that.itemFlow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, config, itemFlow);
    }

    @Override
    public String toString() {
        return "ForEachStep{id=" + id + ", itemFlow=" + itemFlow + "}";
    }
}
