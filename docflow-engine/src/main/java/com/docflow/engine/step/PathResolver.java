package com.docflow.engine.step;

import java.util.List;
import java.util.Map;

/**
 * Dot-path lookup over maps and lists ({@code extract.lines.0.amount}). Missing segments resolve to null.
 */
final class PathResolver {

    private PathResolver() {
    }

    static Object resolve(Object root, String path) {
        if (path == null || path.isBlank()) return root;
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                Integer index = parseIndex(segment);
                current = index != null && index < list.size() ? list.get(index) : null;
            } else {
                return null;
            }
            if (current == null) return null;
        }
        return current;
    }

    private static Integer parseIndex(String segment) {
        try {
            int i = Integer.parseInt(segment);
            return i >= 0 ? i : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
