package com.docflow.consensus;

import com.docflow.flowdefinition.consensus.ConsensusStrategy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups candidate values by canonical JSON and checks the strategy threshold against the number of voters.
 * Group order is first appearance, so a group's first run index is its representative.
 */
final class VoteCounter {

    /** Values that voted together, with the run indexes that produced them. */
    record Group(String key, Object value, List<Integer> runIndexes) {

        int size() {
            return runIndexes.size();
        }
    }

    /**
     * @param winner  group meeting the threshold, or null on a tie
     * @param leaders groups sharing the highest vote count
     */
    record Tally(Group winner, List<Group> leaders, int voters) {

        boolean isTie() {
            return winner == null;
        }
    }

    private VoteCounter() {
    }

    /**
     * @param values run index to candidate value (successful runs only)
     */
    static Tally count(Map<Integer, Object> values, ConsensusStrategy strategy) {
        Map<String, Group> groups = new LinkedHashMap<>();
        for (Map.Entry<Integer, Object> e : values.entrySet()) {
            String key = CanonicalJson.key(e.getValue());
            groups.computeIfAbsent(key, k -> new Group(k, e.getValue(), new ArrayList<>())).runIndexes().add(e.getKey());
        }
        int max = 0;
        List<Group> leaders = new ArrayList<>();
        for (Group g : groups.values()) {
            if (g.size() > max) {
                max = g.size();
                leaders.clear();
                leaders.add(g);
            } else if (g.size() == max) {
                leaders.add(g);
            }
        }
        int voters = values.size();
        Group winner = null;
        if (!leaders.isEmpty()) {
            boolean passes = switch (strategy) {
                case MAJORITY -> max * 2 > voters;
                case UNANIMOUS -> max == voters;
            };
            if (passes) winner = leaders.get(0);
        }
        return new Tally(winner, List.copyOf(leaders), voters);
    }
}
