package com.docflow.consensus;

/**
 * Outcome of one consensus run; {@code result} is null for failed runs, {@code error} null for successful ones.
 */
public record RunOutcome<T>(int runIndex, boolean success, T result, Throwable error, long durationMs) {

    static <T> RunOutcome<T> succeeded(int runIndex, T result, long durationMs) {
        return new RunOutcome<>(runIndex, true, result, null, durationMs);
    }

    static <T> RunOutcome<T> failed(int runIndex, Throwable error, long durationMs) {
        return new RunOutcome<>(runIndex, false, null, error, durationMs);
    }
}
