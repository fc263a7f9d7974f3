package com.docflow.flowdefinition.step;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How an output step shapes the artifacts it reads.
 * <ul>
 *   <li>{@link #NONE} – single source as is; several sources as a map of step id to value</li>
 *   <li>{@link #FIRST} / {@link #LAST} – first/last element of a list source, or first/last of several sources</li>
 *   <li>{@link #MERGE} – shallow merge of object sources, later sources win</li>
 *   <li>{@link #PICK} – only the listed fields of the (merged) object</li>
 * </ul>
 */
public enum OutputTransform {
    NONE,
    FIRST,
    LAST,
    MERGE,
    PICK;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OutputTransform fromValue(String value) {
        if (value == null || value.isBlank()) return NONE;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (OutputTransform t : values()) {
            if (t.name().equals(normalized)) return t;
        }
        throw new IllegalArgumentException("Unknown output transform: " + value);
    }
}
