package com.docflow.flowdefinition.step;

/**
 * Closed set of step kinds. Executors dispatch on this enum; switch expressions over it
 * must stay exhaustive so a new kind cannot be added without handling it.
 */
public enum StepKind {
    STANDARD,
    CONDITIONAL,
    FOR_EACH,
    TRIGGER,
    OUTPUT
}
