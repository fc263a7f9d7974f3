package com.docflow.flowdefinition.mapping;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One field of a {@link InputMappingType#CONSTRUCT} mapping. {@code path} is a dot path into the
 * input (blank = whole input) or into the artifacts; {@code value} is used for literals.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldMapping(FieldSource source, String path, Object value) {

    public FieldMapping {
        source = source != null ? source : FieldSource.INPUT;
    }

    public static FieldMapping input(String path) {
        return new FieldMapping(FieldSource.INPUT, path, null);
    }

    public static FieldMapping artifact(String path) {
        return new FieldMapping(FieldSource.ARTIFACT, path, null);
    }

    public static FieldMapping literal(Object value) {
        return new FieldMapping(FieldSource.LITERAL, null, value);
    }
}
