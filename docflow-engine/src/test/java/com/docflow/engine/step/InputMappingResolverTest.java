package com.docflow.engine.step;

import com.docflow.flowdefinition.mapping.FieldMapping;
import com.docflow.flowdefinition.mapping.InputMapping;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class InputMappingResolverTest {

    private final Map<String, Object> artifacts = Map.of(
            "parse", Map.of("text", "hello", "pages", List.of(Map.of("n", 1), Map.of("n", 2))),
            "meta", Map.of("source", "email"));

    @Test
    void passthrough_returnsInput() {
        Object input = Map.of("a", 1);

        assertSame(input, InputMappingResolver.apply(InputMapping.passthrough(), input, artifacts));
        assertSame(input, InputMappingResolver.apply(null, input, artifacts));
    }

    @Test
    void unwrap_readsInputField() {
        assertEquals("doc", InputMappingResolver.apply(InputMapping.unwrap(), Map.of("input", "doc"), artifacts));
        assertEquals("plain", InputMappingResolver.apply(InputMapping.unwrap(), "plain", artifacts));
    }

    @Test
    void artifact_resolvesDotPathIncludingListIndex() {
        assertEquals(2, InputMappingResolver.apply(InputMapping.artifact("parse.pages.1.n"), "ignored", artifacts));
        assertNull(InputMappingResolver.apply(InputMapping.artifact("parse.pages.5.n"), "ignored", artifacts));
        assertNull(InputMappingResolver.apply(InputMapping.artifact("missing.x"), "ignored", artifacts));
    }

    @Test
    void merge_overlaysArtifactOnInputMap() {
        Object out = InputMappingResolver.apply(InputMapping.merge("meta"), Map.of("source", "upload", "id", 7),
                artifacts);

        assertEquals(Map.of("source", "email", "id", 7), out);
    }

    @Test
    void merge_keepsNonMapInput() {
        assertEquals("raw", InputMappingResolver.apply(InputMapping.merge("meta"), "raw", artifacts));
    }

    @Test
    void construct_buildsMapFromInputArtifactsAndLiterals() {
        Map<String, FieldMapping> fields = new LinkedHashMap<>();
        fields.put("body", FieldMapping.input("text"));
        fields.put("origin", FieldMapping.artifact("meta.source"));
        fields.put("mode", FieldMapping.literal("strict"));
        fields.put("absent", FieldMapping.input("nope"));

        Object out = InputMappingResolver.apply(InputMapping.construct(fields), Map.of("text", "body text"), artifacts);

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("body", "body text");
        expected.put("origin", "email");
        expected.put("mode", "strict");
        expected.put("absent", null);
        assertEquals(expected, out);
    }
}
