package com.docflow.flowdefinition.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Map;
import java.util.Objects;

/**
 * Either an inline {@link FlowDefinition} or a reference ({@code {"flowRef": "id"}}) into the
 * sub-flow registry supplied at build time. Exactly one of the two is set.
 */
@JsonDeserialize(using = FlowOrRefDeserializer.class)
public final class FlowOrRef {

    private final FlowDefinition inline;
    private final String flowRef;

    private FlowOrRef(FlowDefinition inline, String flowRef) {
        this.inline = inline;
        this.flowRef = flowRef;
    }

    public static FlowOrRef inline(FlowDefinition flow) {
        return new FlowOrRef(Objects.requireNonNull(flow, "flow"), null);
    }

    public static FlowOrRef ref(String flowRef) {
        Objects.requireNonNull(flowRef, "flowRef");
        if (flowRef.isBlank()) {
            throw new IllegalArgumentException("flowRef must be non-blank");
        }
        return new FlowOrRef(null, flowRef.trim());
    }

    public boolean isRef() {
        return flowRef != null;
    }

    /** Inline flow, or null when this is a reference. */
    public FlowDefinition getInline() {
        return inline;
    }

    /** Referenced flow id, or null when inline. */
    public String getFlowRef() {
        return flowRef;
    }

    @JsonValue
    public Object toJsonValue() {
        return isRef() ? Map.of("flowRef", flowRef) : inline;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowOrRef that = (FlowOrRef) o;
        return Objects.equals(inline, that.inline) && Objects.equals(flowRef, that.flowRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inline, flowRef);
    }

    @Override
    public String toString() {
        return isRef() ? "FlowOrRef{ref=" + flowRef + "}" : "FlowOrRef{inline=" + inline + "}";
    }
}
