package com.docflow.flowdefinition.consensus;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Voting rule: {@code majority} needs more than half of successful runs, {@code unanimous} all of them. */
public enum ConsensusStrategy {
    MAJORITY,
    UNANIMOUS;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConsensusStrategy fromValue(String value) {
        if (value == null || value.isBlank()) return MAJORITY;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ConsensusStrategy s : values()) {
            if (s.name().equals(normalized)) return s;
        }
        throw new IllegalArgumentException("Unknown consensus strategy: " + value);
    }
}
