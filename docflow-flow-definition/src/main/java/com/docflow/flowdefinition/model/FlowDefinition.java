package com.docflow.flowdefinition.model;

import com.docflow.flowdefinition.step.Step;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A flow: ordered steps plus optional input validation. Immutable.
 * The only understood format version is {@value #SUPPORTED_VERSION}; the builder rejects any other.
 * Inline sub-flows (conditional branches, forEach item flows) may omit the version.
 */
public final class FlowDefinition {

    public static final String SUPPORTED_VERSION = "1.0.0";

    private final String version;
    private final List<Step> steps;
    private final InputValidation inputValidation;

    @JsonCreator
    public FlowDefinition(
            @JsonProperty("version") String version,
            @JsonProperty("steps") List<Step> steps,
            @JsonProperty("inputValidation") InputValidation inputValidation) {
        this.version = version;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.inputValidation = inputValidation;
    }

    public static FlowDefinition of(List<Step> steps) {
        return new FlowDefinition(SUPPORTED_VERSION, steps, null);
    }

    public static FlowDefinition of(Step... steps) {
        return of(List.of(steps));
    }

    public String getVersion() {
        return version;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public InputValidation getInputValidation() {
        return inputValidation;
    }

    public FlowDefinition withInputValidation(InputValidation validation) {
        return new FlowDefinition(version, steps, validation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowDefinition that = (FlowDefinition) o;
        return Objects.equals(version, that.version)
                && Objects.equals(steps, that.steps)
                && Objects.equals(inputValidation, that.inputValidation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, steps, inputValidation);
    }

    @Override
    public String toString() {
        return "FlowDefinition{version=" + version + ", steps=" + steps.size() + "}";
    }
}
