package com.docflow.flowdefinition.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Accepted input MIME types for a flow. Empty list accepts everything.
 * When {@code throwOnInvalid} is false a mismatch is only logged.
 */
public record InputValidation(List<String> acceptedFormats, boolean throwOnInvalid) {

    @JsonCreator
    public InputValidation(
            @JsonProperty("acceptedFormats") List<String> acceptedFormats,
            @JsonProperty("throwOnInvalid") Boolean throwOnInvalid) {
        this(acceptedFormats, throwOnInvalid == null || throwOnInvalid);
    }

    public InputValidation {
        acceptedFormats = acceptedFormats != null
                ? acceptedFormats.stream().map(f -> f.trim().toLowerCase(Locale.ROOT)).toList()
                : List.of();
    }

    /** True when no formats are configured or the (case-insensitive) MIME type is listed. */
    public boolean accepts(String mimeType) {
        if (acceptedFormats.isEmpty()) return true;
        if (mimeType == null || mimeType.isBlank()) return false;
        return acceptedFormats.contains(mimeType.trim().toLowerCase(Locale.ROOT));
    }
}
