package com.docflow.engine.step;

import com.docflow.flowdefinition.step.StepKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Single responsibility: map StepKind to StepHandler. Every kind must have exactly one handler.
 */
public final class StepHandlerRegistry {

    private final Map<StepKind, StepHandler> handlers = new EnumMap<>(StepKind.class);

    public StepHandlerRegistry(List<StepHandler> handlerList) {
        for (StepHandler handler : handlerList) {
            for (StepKind kind : handler.supportedKinds()) {
                if (handlers.putIfAbsent(kind, handler) != null) {
                    throw new IllegalArgumentException("Duplicate handler for step kind " + kind);
                }
            }
        }
        for (StepKind kind : StepKind.values()) {
            if (!handlers.containsKey(kind)) {
                throw new IllegalArgumentException("No handler for step kind " + kind);
            }
        }
    }

    public static StepHandlerRegistry defaults() {
        return new StepHandlerRegistry(List.of(
                new StandardStepHandler(),
                new ConditionalStepHandler(),
                new ForEachStepHandler(),
                new TriggerStepHandler(),
                new OutputStepHandler()));
    }

    public StepHandler forKind(StepKind kind) {
        return handlers.get(kind);
    }
}
