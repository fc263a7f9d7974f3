package com.docflow.consensus;

/**
 * No agreed result: every run failed, or a tie was not resolved under the step's tie policy.
 */
public final class ConsensusException extends RuntimeException {

    private final String stepId;

    public ConsensusException(String stepId, String message) {
        super(message);
        this.stepId = stepId;
    }

    public ConsensusException(String stepId, String message, Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}
