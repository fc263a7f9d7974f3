package com.docflow.flowdefinition.step;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Reads artifacts of earlier steps and records a named flow output. Calls no provider and does not
 * change the value handed to the next step. An empty {@code source} reads the previous step's output.
 */
public final class OutputStep implements Step {

    private final String id;
    private final String name;
    private final List<String> source;
    private final OutputTransform transform;
    private final List<String> fields;

    @JsonCreator
    public OutputStep(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("source") List<String> source,
            @JsonProperty("transform") OutputTransform transform,
            @JsonProperty("fields") List<String> fields) {
        this.id = id;
        this.name = name;
        this.source = source != null ? List.copyOf(source) : List.of();
        this.transform = transform != null ? transform : OutputTransform.NONE;
        this.fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public static OutputStep of(String id, String... source) {
        return new OutputStep(id, null, List.of(source), null, null);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    /** Output name; the step id when no name is set. */
    @JsonIgnore
    public String getOutputName() {
        return name != null && !name.isBlank() ? name : id;
    }

    @Override
    @JsonIgnore
    public StepKind getKind() {
        return StepKind.OUTPUT;
    }

    public List<String> getSource() {
        return source;
    }

    public OutputTransform getTransform() {
        return transform;
    }

    /** Field names for {@link OutputTransform#PICK}. */
    public List<String> getFields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OutputStep that = (OutputStep) o;
        return Objects.equals(id, that.id) && Objects.equals(name, that.name)
                && Objects.equals(source, that.source) && transform == that.transform
                && Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, source, transform, fields);
    }

    @Override
    public String toString() {
        return "OutputStep{id=" + id + ", source=" + source + ", transform=" + transform.toValue() + "}";
    }
}
