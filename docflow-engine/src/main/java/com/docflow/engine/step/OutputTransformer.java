package com.docflow.engine.step;

import com.docflow.flowdefinition.step.OutputTransform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies an output transform to the values an output step reads. A single source is transformed as is;
 * several sources are transformed as the list of their values, except {@link OutputTransform#NONE},
 * which keeps them keyed by step id.
 */
final class OutputTransformer {

    private OutputTransformer() {
    }

    /**
     * @param sources step id to value, in declaration order
     */
    static Object apply(OutputTransform transform, Map<String, Object> sources, List<String> fields) {
        if (transform == OutputTransform.NONE) {
            return sources.size() == 1 ? sources.values().iterator().next() : new LinkedHashMap<>(sources);
        }
        Object data = sources.size() == 1 ? sources.values().iterator().next() : new ArrayList<>(sources.values());
        return switch (transform) {
            case NONE -> data;
            case FIRST -> data instanceof List<?> list ? (list.isEmpty() ? null : list.get(0)) : data;
            case LAST -> data instanceof List<?> list ? (list.isEmpty() ? null : list.get(list.size() - 1)) : data;
            case MERGE -> data instanceof List<?> list ? merge(list) : data;
            case PICK -> pick(data instanceof List<?> list ? merge(list) : data, fields);
        };
    }

    private static Map<Object, Object> merge(List<?> values) {
        Map<Object, Object> merged = new LinkedHashMap<>();
        for (Object v : values) {
            if (v instanceof Map<?, ?> map) merged.putAll(map);
        }
        return merged;
    }

    private static Object pick(Object value, List<String> fields) {
        if (!(value instanceof Map<?, ?> map)) return value;
        Map<String, Object> picked = new LinkedHashMap<>();
        for (String field : fields) {
            if (map.containsKey(field)) picked.put(field, map.get(field));
        }
        return picked;
    }
}
