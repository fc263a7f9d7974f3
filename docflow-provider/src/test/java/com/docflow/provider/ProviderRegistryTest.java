package com.docflow.provider;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderRegistryTest {

    private static final OcrProvider OCR = new OcrProvider() {
        @Override
        public ProviderIdentity identity() {
            return new ProviderIdentity("mistral", "ocr-latest");
        }

        @Override
        public ProviderResponse parse(Object document) {
            return ProviderResponse.of(Map.of("text", String.valueOf(document)));
        }
    };

    private static final VlmProvider VLM = new VlmProvider() {
        @Override
        public ProviderIdentity identity() {
            return new ProviderIdentity("openai", "gpt-4.1");
        }

        @Override
        public ProviderResponse complete(VlmRequest request) {
            return ProviderResponse.of(Map.of());
        }
    };

    @Test
    void register_rejectsDuplicateRef() {
        ProviderRegistry.Builder builder = ProviderRegistry.builder().register("ocr", OCR);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> builder.register(" ocr ", VLM));
        assertTrue(e.getMessage().contains("ocr"));
    }

    @Test
    void register_rejectsBlankRef() {
        assertThrows(IllegalArgumentException.class, () -> ProviderRegistry.builder().register("  ", OCR));
    }

    @Test
    void find_resolvesRegisteredInstances() {
        ProviderRegistry registry = ProviderRegistry.builder().register("ocr", OCR).register("vlm", VLM).build();

        assertSame(OCR, registry.find("ocr").orElseThrow());
        assertEquals(ProviderCapability.VLM, registry.find("vlm").orElseThrow().capability());
        assertFalse(registry.contains("missing"));
        assertFalse(registry.find(null).isPresent());
        assertEquals(2, registry.size());
    }

    @Test
    void withOverrides_pointsChildRefAtParentInstance() {
        ProviderRegistry registry = ProviderRegistry.builder().register("vlm", VLM).build();

        ProviderRegistry child = registry.withOverrides(Map.of("child-vlm", "vlm"));

        assertSame(VLM, child.find("child-vlm").orElseThrow());
        assertSame(VLM, child.find("vlm").orElseThrow());
        assertThrows(IllegalArgumentException.class, () -> registry.withOverrides(Map.of("x", "missing")));
    }

    @Test
    void identity_keyIsVendorAndModel() {
        assertEquals("mistral:ocr-latest", OCR.identity().key());
        assertEquals("acme:default", new ProviderIdentity("acme", " ").key());
    }
}
