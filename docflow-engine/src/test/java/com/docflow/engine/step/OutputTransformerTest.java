package com.docflow.engine.step;

import com.docflow.flowdefinition.step.OutputTransform;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class OutputTransformerTest {

    private static Map<String, Object> sources(Object... idsAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < idsAndValues.length; i += 2) {
            map.put((String) idsAndValues[i], idsAndValues[i + 1]);
        }
        return map;
    }

    @Test
    void none_returnsSingleSourceAsIs() {
        assertEquals(List.of(1, 2), OutputTransformer.apply(OutputTransform.NONE, sources("a", List.of(1, 2)), List.of()));
    }

    @Test
    void none_keysSeveralSourcesByStepId() {
        Object out = OutputTransformer.apply(OutputTransform.NONE, sources("a", 1, "b", 2), List.of());

        assertEquals(Map.of("a", 1, "b", 2), out);
    }

    @Test
    void firstAndLast_takeListEnds() {
        Map<String, Object> single = sources("a", List.of("x", "y", "z"));

        assertEquals("x", OutputTransformer.apply(OutputTransform.FIRST, single, List.of()));
        assertEquals("z", OutputTransformer.apply(OutputTransform.LAST, single, List.of()));
        assertEquals(2, OutputTransformer.apply(OutputTransform.LAST, sources("a", 1, "b", 2), List.of()));
        assertNull(OutputTransformer.apply(OutputTransform.FIRST, sources("a", List.of()), List.of()));
    }

    @Test
    void firstOnScalar_returnsValue() {
        assertEquals("only", OutputTransformer.apply(OutputTransform.FIRST, sources("a", "only"), List.of()));
    }

    @Test
    void merge_laterSourcesWin() {
        Object out = OutputTransformer.apply(OutputTransform.MERGE,
                sources("a", Map.of("k", 1, "x", "a"), "b", "not a map", "c", Map.of("x", "c")), List.of());

        assertEquals(Map.of("k", 1, "x", "c"), out);
    }

    @Test
    void pick_keepsNamedFieldsThatExist() {
        Object out = OutputTransformer.apply(OutputTransform.PICK,
                sources("a", Map.of("total", 5, "vendor", "acme", "raw", "...")), List.of("vendor", "total", "missing"));

        assertEquals(Map.of("vendor", "acme", "total", 5), out);
        assertEquals(List.of("vendor", "total"), List.copyOf(((Map<?, ?>) out).keySet()));
    }

    @Test
    void pick_overSeveralSourcesMergesFirst() {
        Object out = OutputTransformer.apply(OutputTransform.PICK,
                sources("a", Map.of("total", 5), "b", Map.of("vendor", "acme")), List.of("total", "vendor"));

        assertEquals(Map.of("total", 5, "vendor", "acme"), out);
    }
}
