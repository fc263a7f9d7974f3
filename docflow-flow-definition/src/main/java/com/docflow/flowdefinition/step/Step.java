package com.docflow.flowdefinition.step;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One step of a flow. JSON discriminator is {@code type}: {@code step}, {@code conditional},
 * {@code forEach}, {@code trigger} or {@code output}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StandardStep.class, name = "step"),
        @JsonSubTypes.Type(value = ConditionalStep.class, name = "conditional"),
        @JsonSubTypes.Type(value = ForEachStep.class, name = "forEach"),
        @JsonSubTypes.Type(value = TriggerStep.class, name = "trigger"),
        @JsonSubTypes.Type(value = OutputStep.class, name = "output")
})
public interface Step {

    /** Step id; unique within its flow. */
    String getId();

    /** Optional human-readable name. */
    String getName();

    StepKind getKind();
}
