package com.docflow.engine.step;

import com.docflow.flowdefinition.step.StepKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StepHandlerRegistryTest {

    @Test
    void defaults_coverEveryKind() {
        StepHandlerRegistry registry = StepHandlerRegistry.defaults();

        for (StepKind kind : StepKind.values()) {
            assertNotNull(registry.forKind(kind), kind.name());
        }
        assertInstanceOf(ForEachStepHandler.class, registry.forKind(StepKind.FOR_EACH));
    }

    @Test
    void missingKind_rejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new StepHandlerRegistry(List.of(
                new StandardStepHandler(), new ConditionalStepHandler(), new ForEachStepHandler(),
                new TriggerStepHandler())));

        assertTrue(e.getMessage().contains("OUTPUT"));
    }

    @Test
    void duplicateKind_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new StepHandlerRegistry(List.of(
                new StandardStepHandler(), new ConditionalStepHandler(), new ForEachStepHandler(),
                new TriggerStepHandler(), new OutputStepHandler(), new StandardStepHandler())));
    }
}
