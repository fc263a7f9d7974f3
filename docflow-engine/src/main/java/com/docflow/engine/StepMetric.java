package com.docflow.engine;

import java.util.List;

/**
 * Usage and timing of one step. Metrics of sub-flows are merged into the parent with a prefixed step id
 * ({@code trigger.extract}, {@code fe.item[2].extract}) and {@code nested} set.
 *
 * @param kind   {@link Kind#LEAF} for steps that called providers, {@link Kind#WRAPPER} for the total of a
 *               composite step whose children carry their own metrics
 * @param rollup composite details of a wrapper metric; null for leaf metrics
 */
public record StepMetric(
        String stepId,
        String provider,
        String model,
        long tokensIn,
        long tokensOut,
        double costUsd,
        long durationMs,
        int attemptNumber,
        Kind kind,
        boolean nested,
        Rollup rollup
) {
    public enum Kind {
        LEAF,
        WRAPPER
    }

    /**
     * What a composite step adds on top of its children. {@code overheadMs} is the wrapper's own time
     * (total minus the leaf time beneath it, never negative); the counts are ForEach items and stay zero
     * for other composites. A non-null {@code error} marks a failed composite.
     */
    public record Rollup(String type, long overheadMs, int itemCount, int successCount, int failureCount,
                         String error) {

        public boolean failed() {
            return error != null;
        }
    }

    public static StepMetric leaf(String stepId, String provider, String model, long tokensIn, long tokensOut,
                                  double costUsd, long durationMs, int attemptNumber) {
        return new StepMetric(stepId, provider, model, tokensIn, tokensOut, costUsd, durationMs, attemptNumber,
                Kind.LEAF, false, null);
    }

    /**
     * Wrapper of a finished composite. Its cost is the total of the leaf metrics given (the composite's own
     * provider call plus its children), so it must not be added to flow totals again.
     */
    public static StepMetric wrapper(String stepId, StepMetric own, List<StepMetric> children, long durationMs,
                                     String type, int itemCount, int successCount, int failureCount) {
        double cost = leafCost(children) + (own != null ? own.costUsd() : 0.0);
        long leafMs = leafDurationMs(children) + (own != null ? own.durationMs() : 0L);
        return new StepMetric(stepId, own != null ? own.provider() : null, own != null ? own.model() : null,
                0, 0, cost, durationMs, 1, Kind.WRAPPER, false,
                new Rollup(type, Math.max(0L, durationMs - leafMs), itemCount, successCount, failureCount, null));
    }

    public static StepMetric failedWrapper(String stepId, String type, long durationMs, int itemCount,
                                           Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new StepMetric(stepId, null, null, 0, 0, 0.0, durationMs, 1, Kind.WRAPPER, false,
                new Rollup(type, durationMs, itemCount, 0, 0, message));
    }

    public boolean isWrapper() {
        return kind == Kind.WRAPPER;
    }

    public StepMetric prefixed(String prefix) {
        return new StepMetric(prefix + "." + stepId, provider, model, tokensIn, tokensOut, costUsd, durationMs,
                attemptNumber, kind, true, rollup);
    }

    static double leafCost(List<StepMetric> metrics) {
        return metrics.stream().filter(m -> !m.isWrapper()).mapToDouble(StepMetric::costUsd).sum();
    }

    static long leafDurationMs(List<StepMetric> metrics) {
        return metrics.stream().filter(m -> !m.isWrapper()).mapToLong(StepMetric::durationMs).sum();
    }
}
