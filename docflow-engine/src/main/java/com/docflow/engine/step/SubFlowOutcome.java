package com.docflow.engine.step;

import com.docflow.engine.StepMetric;

import java.util.List;
import java.util.Map;

/** Result of running a branch, item flow or triggered flow in its own execution context. */
public record SubFlowOutcome(Object output, Map<String, Object> artifacts, List<StepMetric> metrics) {

    public SubFlowOutcome {
        artifacts = artifacts != null ? artifacts : Map.of();
        metrics = metrics != null ? List.copyOf(metrics) : List.of();
    }
}
