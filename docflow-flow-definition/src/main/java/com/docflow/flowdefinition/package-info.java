/**
 * Declarative flow definitions and their JSON form.
 *
 * <ul>
 *   <li>{@link com.docflow.flowdefinition.model} – {@link com.docflow.flowdefinition.model.FlowDefinition},
 *       inline-or-referenced sub-flows ({@link com.docflow.flowdefinition.model.FlowOrRef}) and input validation</li>
 *   <li>{@link com.docflow.flowdefinition.step} – the step kinds (standard, conditional, forEach, trigger, output)</li>
 *   <li>{@link com.docflow.flowdefinition.consensus} – consensus settings of a provider step</li>
 *   <li>{@link com.docflow.flowdefinition.mapping} – trigger input mappings</li>
 *   <li>{@link com.docflow.flowdefinition.FlowDefinitionConfig} – {@code fromJson}/{@code toJson} for single flows
 *       and sub-flow registries</li>
 * </ul>
 * Pure data: nothing in this package resolves references or calls providers.
 */
package com.docflow.flowdefinition;
