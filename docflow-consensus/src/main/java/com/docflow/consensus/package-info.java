/**
 * Consensus execution: run one logical call N times and reduce the results by vote.
 * <p>
 * {@link com.docflow.consensus.ConsensusEngine#run} launches the runs, keeps their outcomes by run index,
 * votes with {@link com.docflow.consensus.VoteCounter} and applies the tie policy. Results are compared by
 * canonical JSON ({@link com.docflow.consensus.CanonicalJson}), whole value by default or per top-level
 * field when the step asks for field-level voting.
 */
package com.docflow.consensus;
