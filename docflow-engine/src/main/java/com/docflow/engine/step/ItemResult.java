package com.docflow.engine.step;

/**
 * Outcome of one forEach item; {@code output} is set on success, {@code error} (the failure message) otherwise.
 */
public record ItemResult(int index, Status status, Object output, String error, long durationMs) {

    public enum Status {
        SUCCESS,
        FAILED
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
