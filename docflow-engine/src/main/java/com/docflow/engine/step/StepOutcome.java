package com.docflow.engine.step;

/**
 * What a handler produced: {@code artifact} is stored under the step id, {@code next} is passed to the
 * following step. They differ only for output steps, which pass their input through.
 */
public record StepOutcome(Object artifact, Object next) {

    public static StepOutcome of(Object value) {
        return new StepOutcome(value, value);
    }
}
