package com.docflow.engine.step;

import com.docflow.consensus.ConsensusResult;
import com.docflow.engine.StepMetric;
import com.docflow.resilience.FallbackResult;

/**
 * Value and metric of a provider-backed step; {@code consensus} is null unless the step ran with consensus.
 */
public record ProviderStepOutcome(Object value, StepMetric metric, ConsensusResult<FallbackResult> consensus) {
}
