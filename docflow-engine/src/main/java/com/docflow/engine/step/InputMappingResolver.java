package com.docflow.engine.step;

import com.docflow.flowdefinition.mapping.FieldMapping;
import com.docflow.flowdefinition.mapping.InputMapping;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the input of a triggered flow from the trigger's input and the parent's artifacts.
 */
final class InputMappingResolver {

    static final String WRAPPED_INPUT_FIELD = "input";

    private InputMappingResolver() {
    }

    static Object apply(InputMapping mapping, Object input, Map<String, Object> artifacts) {
        if (mapping == null) return input;
        return switch (mapping.getType()) {
            case PASSTHROUGH -> input;
            case UNWRAP -> input instanceof Map<?, ?> map && map.containsKey(WRAPPED_INPUT_FIELD)
                    ? map.get(WRAPPED_INPUT_FIELD)
                    : input;
            case ARTIFACT -> PathResolver.resolve(artifacts, mapping.getPath());
            case MERGE -> merge(input, PathResolver.resolve(artifacts, mapping.getPath()));
            case CONSTRUCT -> construct(mapping.getFields(), input, artifacts);
        };
    }

    private static Object merge(Object input, Object artifact) {
        if (input instanceof Map<?, ?> in && artifact instanceof Map<?, ?> extra) {
            Map<Object, Object> merged = new LinkedHashMap<>(in);
            merged.putAll(extra);
            return merged;
        }
        return input;
    }

    private static Map<String, Object> construct(Map<String, FieldMapping> fields, Object input,
                                                 Map<String, Object> artifacts) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, FieldMapping> e : fields.entrySet()) {
            FieldMapping field = e.getValue();
            Object value = switch (field.source()) {
                case INPUT -> PathResolver.resolve(input, field.path());
                case ARTIFACT -> PathResolver.resolve(artifacts, field.path());
                case LITERAL -> field.value();
            };
            result.put(e.getKey(), value);
        }
        return result;
    }
}
