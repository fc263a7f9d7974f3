package com.docflow.flowdefinition.step;

import com.docflow.flowdefinition.mapping.InputMapping;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a named sub-flow from the registry.
 * <p>
 * {@code providerOverrides} maps a provider ref used inside the child flow to a provider ref of
 * the parent's registry. {@code mergeMetrics} defaults to true. {@code timeoutMs} null means no deadline.
 */
public final class TriggerStep implements Step {

    private final String id;
    private final String name;
    private final String flowRef;
    private final Map<String, String> providerOverrides;
    private final InputMapping inputMapping;
    private final boolean mergeMetrics;
    private final Long timeoutMs;

    @JsonCreator
    public TriggerStep(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("flowRef") String flowRef,
            @JsonProperty("providerOverrides") Map<String, String> providerOverrides,
            @JsonProperty("inputMapping") InputMapping inputMapping,
            @JsonProperty("mergeMetrics") Boolean mergeMetrics,
            @JsonProperty("timeoutMs") Long timeoutMs) {
        this.id = id;
        this.name = name;
        this.flowRef = flowRef;
        this.providerOverrides = providerOverrides != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(providerOverrides)) : Map.of();
        this.inputMapping = inputMapping != null ? inputMapping : InputMapping.passthrough();
        this.mergeMetrics = mergeMetrics == null || mergeMetrics;
        this.timeoutMs = timeoutMs;
    }

    public static TriggerStep of(String id, String flowRef) {
        return new TriggerStep(id, null, flowRef, null, null, null, null);
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
        return StepKind.TRIGGER;
    }

    public String getFlowRef() {
        return flowRef;
    }

    public Map<String, String> getProviderOverrides() {
        return providerOverrides;
    }

    /** Never null; passthrough when not configured. */
    public InputMapping getInputMapping() {
        return inputMapping;
    }

    public boolean isMergeMetrics() {
        return mergeMetrics;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TriggerStep that = (TriggerStep) o;
        return mergeMetrics == that.mergeMetrics && Objects.equals(id, that.id)
                && Objects.equals(name, that.name) && Objects.equals(flowRef, that.flowRef)
                && Objects.equals(providerOverrides, that.providerOverrides)
                && Objects.equals(inputMapping, that.inputMapping) && Objects.equals(timeoutMs, that.timeoutMs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, flowRef, providerOverrides, inputMapping, mergeMetrics, timeoutMs);
    }

    @Override
    public String toString() {
        return "TriggerStep{id=" + id + ", flowRef=" + flowRef + "}";
    }
}
