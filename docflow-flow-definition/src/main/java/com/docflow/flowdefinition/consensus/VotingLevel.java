package com.docflow.flowdefinition.consensus;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Granularity of comparison: whole result ({@code object}) or per top-level field ({@code field}). */
public enum VotingLevel {
    OBJECT,
    FIELD;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VotingLevel fromValue(String value) {
        if (value == null || value.isBlank()) return OBJECT;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (VotingLevel l : values()) {
            if (l.name().equals(normalized)) return l;
        }
        throw new IllegalArgumentException("Unknown voting level: " + value);
    }
}
