package com.docflow.consensus;

import com.docflow.flowdefinition.consensus.ConsensusStrategy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Field-level voting over object results: each top-level field is voted on independently and the
 * winners are composed into one object. A run missing a field votes for null on that field.
 */
final class FieldVoter {

    private FieldVoter() {
    }

    static boolean supports(Collection<Object> values) {
        if (values.isEmpty()) return false;
        for (Object v : values) {
            if (!(v instanceof Map)) return false;
        }
        return true;
    }

    static Decision vote(Map<Integer, Object> values, ConsensusStrategy strategy, Random random) {
        Set<String> fields = new LinkedHashSet<>();
        for (Object v : values.values()) {
            for (Object k : ((Map<?, ?>) v).keySet()) {
                fields.add(String.valueOf(k));
            }
        }
        int voters = values.size();
        Map<String, Object> composed = new LinkedHashMap<>();
        Map<String, Double> fieldAgreement = new LinkedHashMap<>();
        List<String> tied = new ArrayList<>();
        int weakest = voters;
        for (String field : fields) {
            Map<Integer, Object> fieldValues = new LinkedHashMap<>();
            for (Map.Entry<Integer, Object> e : values.entrySet()) {
                fieldValues.put(e.getKey(), ((Map<?, ?>) e.getValue()).get(field));
            }
            VoteCounter.Tally tally = VoteCounter.count(fieldValues, strategy);
            VoteCounter.Group chosen;
            if (tally.isTie()) {
                tied.add(field);
                chosen = tally.leaders().get(random.nextInt(tally.leaders().size()));
            } else {
                chosen = tally.winner();
            }
            composed.put(field, chosen.value());
            fieldAgreement.put(field, (double) chosen.size() / voters);
            weakest = Math.min(weakest, chosen.size());
        }

        String composedKey = CanonicalJson.key(composed);
        int selected = -1;
        int bestMatches = -1;
        for (Map.Entry<Integer, Object> e : values.entrySet()) {
            Map<?, ?> run = (Map<?, ?>) e.getValue();
            if (CanonicalJson.key(run).equals(composedKey)) {
                selected = e.getKey();
                bestMatches = Integer.MAX_VALUE;
                break;
            }
            int matches = 0;
            for (String field : fields) {
                if (CanonicalJson.key(run.get(field)).equals(CanonicalJson.key(composed.get(field)))) matches++;
            }
            if (matches > bestMatches) {
                bestMatches = matches;
                selected = e.getKey();
            }
        }
        boolean synthetic = bestMatches != Integer.MAX_VALUE;
        return new Decision(composed, selected, weakest, !tied.isEmpty(), false, synthetic, fieldAgreement,
                List.of(), List.copyOf(tied));
    }
}
