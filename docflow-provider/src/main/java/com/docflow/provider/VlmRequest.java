package com.docflow.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized VLM call. {@code operation} is the step's node type ({@code extract}, {@code split},
 * {@code categorize}); {@code categories} is only set for categorize.
 */
public record VlmRequest(
        String operation,
        Object input,
        Map<String, Object> schema,
        List<String> categories,
        Integer maxTokens
) {
    public VlmRequest {
        schema = schema != null ? Collections.unmodifiableMap(new LinkedHashMap<>(schema)) : null;
        categories = categories != null ? List.copyOf(categories) : List.of();
    }
}
