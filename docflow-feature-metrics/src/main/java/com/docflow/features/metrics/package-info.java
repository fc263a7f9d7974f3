/**
 * Micrometer metrics for flow executions, registered as a {@link com.docflow.observability.FlowEventListener}.
 */
package com.docflow.features.metrics;
