package com.docflow.flowdefinition.mapping;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Trigger input mapping. {@code path} is used by {@link InputMappingType#ARTIFACT} and
 * {@link InputMappingType#MERGE}; {@code fields} by {@link InputMappingType#CONSTRUCT}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class InputMapping {

    private final InputMappingType type;
    private final String path;
    private final Map<String, FieldMapping> fields;

    @JsonCreator
    public InputMapping(
            @JsonProperty("type") InputMappingType type,
            @JsonProperty("path") String path,
            @JsonProperty("fields") Map<String, FieldMapping> fields) {
        this.type = type != null ? type : InputMappingType.PASSTHROUGH;
        this.path = path;
        this.fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    public static InputMapping passthrough() {
        return new InputMapping(InputMappingType.PASSTHROUGH, null, null);
    }

    public static InputMapping unwrap() {
        return new InputMapping(InputMappingType.UNWRAP, null, null);
    }

    public static InputMapping artifact(String path) {
        return new InputMapping(InputMappingType.ARTIFACT, path, null);
    }

    public static InputMapping merge(String artifactPath) {
        return new InputMapping(InputMappingType.MERGE, artifactPath, null);
    }

    public static InputMapping construct(Map<String, FieldMapping> fields) {
        return new InputMapping(InputMappingType.CONSTRUCT, null, fields);
    }

    public InputMappingType getType() {
        return type;
    }

    public String getPath() {
        return path;
    }

    public Map<String, FieldMapping> getFields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InputMapping that = (InputMapping) o;
        return type == that.type && Objects.equals(path, that.path) && Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, path, fields);
    }

    @Override
    public String toString() {
        return "InputMapping{type=" + type.toValue() + (path != null ? ", path=" + path : "") + "}";
    }
}
