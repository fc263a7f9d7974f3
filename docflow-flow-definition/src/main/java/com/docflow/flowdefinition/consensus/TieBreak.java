package com.docflow.flowdefinition.consensus;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What to do when no result group meets the strategy threshold.
 * {@link #RETRY} performs one extra run and votes once more; a second tie fails.
 */
public enum TieBreak {
    RANDOM,
    FAIL,
    RETRY;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TieBreak fromValue(String value) {
        if (value == null || value.isBlank()) return RANDOM;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (TieBreak t : values()) {
            if (t.name().equals(normalized)) return t;
        }
        throw new IllegalArgumentException("Unknown onTie value: " + value);
    }
}
