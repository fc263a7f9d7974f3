package com.docflow.flowdefinition.step;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One provider invocation: parse, extract, split or categorize.
 */
public final class StandardStep implements Step {

    private final String id;
    private final String name;
    private final NodeType nodeType;
    private final StepConfig config;

    @JsonCreator
    public StandardStep(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("nodeType") NodeType nodeType,
            @JsonProperty("config") StepConfig config) {
        this.id = id;
        this.name = name;
        this.nodeType = nodeType != null ? nodeType : NodeType.UNKNOWN;
        this.config = config != null ? config : StepConfig.provider(null);
    }

    public static StandardStep of(String id, NodeType nodeType, StepConfig config) {
        return new StandardStep(id, null, nodeType, config);
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
        return StepKind.STANDARD;
    }

    /** Never null; {@link NodeType#UNKNOWN} when missing or unrecognized. */
    public NodeType getNodeType() {
        return nodeType;
    }

    public StepConfig getConfig() {
        return config;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StandardStep that = (StandardStep) o;
        return Objects.equals(id, that.id) && Objects.equals(name, that.name)
                && nodeType == that.nodeType && Objects.equals(config, that.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, nodeType, config);
    }

    @Override
    public String toString() {
        return "StandardStep{id=" + id + ", nodeType=" + nodeType.toValue() + "}";
    }
}
