/**
 * Lifecycle hook contract of the flow engine.
 *
 * <ul>
 *   <li>{@link com.docflow.observability.FlowEventListener} – one no-op default method per event; implement only what you need</li>
 *   <li>{@link com.docflow.observability.event} – immutable event contexts, each carrying a {@link com.docflow.observability.TraceContext}</li>
 *   <li>{@link com.docflow.observability.HookDispatcher} – fans events out to listeners in registration order; listener
 *       failures go to a {@link com.docflow.observability.HookErrorHandler} and never reach the pipeline</li>
 * </ul>
 * Shipping events to a collector is left to listener implementations.
 */
package com.docflow.observability;
