/**
 * Flow execution engine.
 * <ul>
 *   <li>{@code com.docflow.engine} – {@link com.docflow.engine.FlowExecutor}, run-scoped
 *       {@link com.docflow.engine.ExecutionContext}, results, errors and {@link com.docflow.engine.EngineConfig}</li>
 *   <li>{@code com.docflow.engine.build} – build-time resolution and validation of flow definitions into
 *       {@link com.docflow.engine.build.ExecutableFlow}</li>
 *   <li>{@code com.docflow.engine.step} – one handler per step kind, dispatched through
 *       {@link com.docflow.engine.step.StepHandlerRegistry}</li>
 * </ul>
 */
package com.docflow.engine;
