package com.docflow.flowdefinition.mapping;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a trigger computes its child input.
 * <ul>
 *   <li>{@link #PASSTHROUGH} – the step input unchanged</li>
 *   <li>{@link #UNWRAP} – the {@code input} field of an envelope object, else the value itself</li>
 *   <li>{@link #ARTIFACT} – an artifact addressed by dot path ({@code stepId.field.0})</li>
 *   <li>{@link #MERGE} – input object merged with an artifact object (artifact wins)</li>
 *   <li>{@link #CONSTRUCT} – a new object built from named field sources</li>
 * </ul>
 */
public enum InputMappingType {
    PASSTHROUGH,
    UNWRAP,
    ARTIFACT,
    MERGE,
    CONSTRUCT;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InputMappingType fromValue(String value) {
        if (value == null || value.isBlank()) return PASSTHROUGH;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (InputMappingType t : values()) {
            if (t.name().equals(normalized)) return t;
        }
        throw new IllegalArgumentException("Unknown input mapping type: " + value);
    }
}
