package com.docflow.engine.step;

import com.docflow.consensus.ConsensusEngine;
import com.docflow.consensus.ConsensusResult;
import com.docflow.consensus.ConsensusScope;
import com.docflow.consensus.RunOutcome;
import com.docflow.engine.StepMetric;
import com.docflow.engine.build.PlannedStep;
import com.docflow.flowdefinition.step.StepConfig;
import com.docflow.provider.OcrProvider;
import com.docflow.provider.ProviderInstance;
import com.docflow.provider.ProviderResponse;
import com.docflow.provider.VlmProvider;
import com.docflow.provider.VlmRequest;
import com.docflow.resilience.CallScope;
import com.docflow.resilience.FallbackManager;
import com.docflow.resilience.FallbackResult;
import com.docflow.resilience.ProviderCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls the provider chain of a step through the fallback manager, wrapped in the consensus engine when
 * the step configures consensus. Token usage and cost are summed over every successful run.
 */
public final class ProviderStepInvoker {

    private static final Logger log = LoggerFactory.getLogger(ProviderStepInvoker.class);

    private final FallbackManager fallbackManager;
    private final ConsensusEngine consensusEngine;

    public ProviderStepInvoker(FallbackManager fallbackManager, ConsensusEngine consensusEngine) {
        this.fallbackManager = fallbackManager;
        this.consensusEngine = consensusEngine;
    }

    /**
     * @param operation node type passed to VLM providers ({@code extract}, {@code categorize}, {@code split})
     */
    public ProviderStepOutcome invoke(PlannedStep step, String operation, StepConfig config, Object input,
                                      FlowScope scope) {
        long start = System.currentTimeMillis();
        ProviderCall call = provider -> callProvider(provider, operation, config, input);
        CallScope callScope = new CallScope(step.getId(), scope.trace());

        if (config.getConsensus() == null) {
            FallbackResult result = fallbackManager.callWithFallback(step.getProviders(), call, callScope);
            ProviderResponse response = result.response();
            StepMetric metric = StepMetric.leaf(step.getId(), result.providerKey(), response.model(),
                    response.tokensIn(), response.tokensOut(), response.costUsd(),
                    System.currentTimeMillis() - start, result.attemptNumber());
            return new ProviderStepOutcome(response.value(), metric, null);
        }

        ConsensusResult<FallbackResult> consensus = consensusEngine.run(config.getConsensus(),
                runIndex -> fallbackManager.callWithFallback(step.getProviders(), call, callScope),
                r -> r.response().value(),
                new ConsensusScope(step.getId(), scope.trace()));
        long tokensIn = 0;
        long tokensOut = 0;
        double cost = 0.0;
        for (RunOutcome<FallbackResult> run : consensus.perRunResults()) {
            if (!run.success()) continue;
            tokensIn += run.result().response().tokensIn();
            tokensOut += run.result().response().tokensOut();
            cost += run.result().response().costUsd();
        }
        FallbackResult selected = consensus.selectedResult();
        log.debug("Step {} consensus: agreement {} over {} runs, selected run {}", step.getId(),
                consensus.agreement(), consensus.totalRuns(), consensus.selectedRunIndex());
        StepMetric metric = StepMetric.leaf(step.getId(),
                selected != null ? selected.providerKey() : null,
                selected != null ? selected.response().model() : null,
                tokensIn, tokensOut, cost, System.currentTimeMillis() - start,
                selected != null ? selected.attemptNumber() : 0);
        return new ProviderStepOutcome(consensus.agreedValue(), metric, consensus);
    }

    private static ProviderResponse callProvider(ProviderInstance provider, String operation, StepConfig config,
                                                 Object input) throws Exception {
        if (provider instanceof OcrProvider ocr) {
            return ocr.parse(input);
        }
        if (provider instanceof VlmProvider vlm) {
            return vlm.complete(new VlmRequest(operation, input, config.getSchema(), config.getCategories(),
                    config.getMaxTokens()));
        }
        throw new IllegalStateException("Unsupported provider type: " + provider.getClass().getName());
    }
}
