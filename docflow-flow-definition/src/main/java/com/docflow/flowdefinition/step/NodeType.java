package com.docflow.flowdefinition.step;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Operation of a provider-backed step. {@link #PARSE} needs an OCR-capable provider; the others
 * need a VLM-capable provider. Unknown values deserialize as {@link #UNKNOWN} and fail the build.
 */
public enum NodeType {
    PARSE,
    EXTRACT,
    SPLIT,
    CATEGORIZE,
    /** Used when the definition contains an unknown node type string. */
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (NodeType t : values()) {
            if (t != UNKNOWN && t.name().equals(normalized)) return t;
        }
        return UNKNOWN;
    }

    public boolean requiresOcr() {
        return this == PARSE;
    }
}
