package com.docflow.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a flow run.
 *
 * @param output    value of the last output step that ran, else the last step's output
 * @param outputs   named outputs of every output step, in execution order
 * @param artifacts every artifact written, in write order
 * @param metrics   step metrics, nested sub-flow metrics included; totals skip wrapper metrics, whose cost
 *                  repeats the leaf metrics beneath them
 */
public record FlowResult(
        Object output,
        Map<String, Object> outputs,
        Map<String, Object> artifacts,
        List<StepMetric> metrics,
        String traceId
) {
    public FlowResult {
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        artifacts = Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
        metrics = List.copyOf(metrics);
    }

    public long totalTokensIn() {
        return metrics.stream().mapToLong(StepMetric::tokensIn).sum();
    }

    public long totalTokensOut() {
        return metrics.stream().mapToLong(StepMetric::tokensOut).sum();
    }

    public double totalCostUsd() {
        return StepMetric.leafCost(metrics);
    }
}
