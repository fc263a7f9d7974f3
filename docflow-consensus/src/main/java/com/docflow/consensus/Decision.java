package com.docflow.consensus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Vote outcome before the tie policy is applied. An object-level tie carries the leading candidates;
 * a field-level tie carries the tied field names and an already composed value with each tied field
 * picked at random.
 */
record Decision(
        Object value,
        int selectedRunIndex,
        int agreeingRuns,
        boolean tie,
        boolean tieBreakerUsed,
        boolean synthetic,
        Map<String, Double> fieldAgreement,
        List<Candidate> leaders,
        List<String> tiedFields
) {
    /** A value some runs agreed on. */
    record Candidate(Object value, int runIndex, int votes) {
    }

    static Decision of(VoteCounter.Tally tally) {
        if (tally.isTie()) {
            List<Candidate> leaders = new ArrayList<>();
            for (VoteCounter.Group g : tally.leaders()) {
                leaders.add(new Candidate(g.value(), g.runIndexes().get(0), g.size()));
            }
            return new Decision(null, -1, 0, true, false, false, Map.of(), List.copyOf(leaders), List.of());
        }
        VoteCounter.Group w = tally.winner();
        return new Decision(w.value(), w.runIndexes().get(0), w.size(), false, false, false, Map.of(),
                List.of(), List.of());
    }

    Decision breakTie(Random random) {
        if (!tie) return this;
        if (leaders.isEmpty()) {
            return new Decision(value, selectedRunIndex, agreeingRuns, false, true, synthetic, fieldAgreement,
                    List.of(), List.of());
        }
        Candidate pick = leaders.get(random.nextInt(leaders.size()));
        return new Decision(pick.value(), pick.runIndex(), pick.votes(), false, true, false, fieldAgreement,
                List.of(), List.of());
    }

    String describeLeaders() {
        if (!tiedFields.isEmpty()) {
            return "tied fields: " + String.join(", ", tiedFields);
        }
        return leaders.stream()
                .map(c -> "run " + c.runIndex() + ": " + c.votes() + " vote(s)")
                .collect(Collectors.joining(", "));
    }
}
