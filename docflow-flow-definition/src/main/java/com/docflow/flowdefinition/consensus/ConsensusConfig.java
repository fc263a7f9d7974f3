package com.docflow.flowdefinition.consensus;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Consensus settings of a provider step: run the call {@code runs} times and vote.
 * Defaults: majority, random tie-break, whole-object comparison.
 */
public record ConsensusConfig(int runs, ConsensusStrategy strategy, TieBreak onTie, VotingLevel level) {

    @JsonCreator
    public ConsensusConfig(
            @JsonProperty("runs") Integer runs,
            @JsonProperty("strategy") ConsensusStrategy strategy,
            @JsonProperty("onTie") TieBreak onTie,
            @JsonProperty("level") VotingLevel level) {
        this(runs != null ? runs : 0, strategy, onTie, level);
    }

    public ConsensusConfig {
        strategy = strategy != null ? strategy : ConsensusStrategy.MAJORITY;
        onTie = onTie != null ? onTie : TieBreak.RANDOM;
        level = level != null ? level : VotingLevel.OBJECT;
    }

    public static ConsensusConfig majority(int runs) {
        return new ConsensusConfig(runs, ConsensusStrategy.MAJORITY, TieBreak.RANDOM, VotingLevel.OBJECT);
    }

    public static ConsensusConfig unanimous(int runs, TieBreak onTie) {
        return new ConsensusConfig(runs, ConsensusStrategy.UNANIMOUS, onTie, VotingLevel.OBJECT);
    }

    public ConsensusConfig withOnTie(TieBreak value) {
        return new ConsensusConfig(runs, strategy, value, level);
    }

    public ConsensusConfig withLevel(VotingLevel value) {
        return new ConsensusConfig(runs, strategy, onTie, value);
    }
}
