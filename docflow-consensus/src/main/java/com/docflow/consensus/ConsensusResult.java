package com.docflow.consensus;

import com.docflow.flowdefinition.consensus.TieBreak;

import java.util.List;
import java.util.Map;

/**
 * Reduced outcome of a consensus execution.
 *
 * @param agreedValue       winning value; for field-level voting a composed object that may match no single run
 * @param selectedRunIndex  run whose value is (or is closest to) the agreed value
 * @param agreement         agreeing runs / total runs (failed and retry runs included in the total)
 * @param perRunResults     every run in run index order, the tie-break retry run last
 * @param tieBreakerUsed    tie policy that decided the result, null when the vote passed outright
 * @param fieldAgreement    per-field share of the leading value among successful runs (field-level voting only)
 */
public record ConsensusResult<T>(
        Object agreedValue,
        int selectedRunIndex,
        double agreement,
        List<RunOutcome<T>> perRunResults,
        TieBreak tieBreakerUsed,
        boolean retried,
        boolean synthetic,
        Map<String, Double> fieldAgreement
) {
    public ConsensusResult {
        perRunResults = List.copyOf(perRunResults);
        fieldAgreement = fieldAgreement != null ? Map.copyOf(fieldAgreement) : Map.of();
    }

    public int totalRuns() {
        return perRunResults.size();
    }

    public int successfulRuns() {
        return (int) perRunResults.stream().filter(RunOutcome::success).count();
    }

    public int failedRuns() {
        return totalRuns() - successfulRuns();
    }

    /** Raw result of the selected run. */
    public T selectedResult() {
        for (RunOutcome<T> o : perRunResults) {
            if (o.runIndex() == selectedRunIndex) return o.result();
        }
        return null;
    }
}
