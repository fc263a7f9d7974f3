package com.docflow.flowdefinition.mapping;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Where a constructed field reads its value from. */
public enum FieldSource {
    INPUT,
    ARTIFACT,
    LITERAL;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FieldSource fromValue(String value) {
        if (value == null || value.isBlank()) return INPUT;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (FieldSource s : values()) {
            if (s.name().equals(normalized)) return s;
        }
        throw new IllegalArgumentException("Unknown field source: " + value);
    }
}
