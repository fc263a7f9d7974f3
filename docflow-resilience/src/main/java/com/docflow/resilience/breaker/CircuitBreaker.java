package com.docflow.resilience.breaker;

import java.time.Clock;
import java.util.Objects;

/**
 * Consecutive-failure breaker for one provider key. Opens after {@code threshold} recorded failures;
 * once {@code resetTimeoutMs} has passed since the last failure exactly one caller acquires a trial.
 * A failed trial re-opens the breaker, a successful one closes it.
 * <p>
 * All state changes are serialized on the breaker instance.
 */
public final class CircuitBreaker {

    private final String key;
    private final int threshold;
    private final long resetTimeoutMs;
    private final Clock clock;

    private int consecutiveFailures;
    private long lastFailureTime;
    private boolean open;
    private boolean trialInFlight;

    CircuitBreaker(String key, int threshold, long resetTimeoutMs, Clock clock) {
        this.key = Objects.requireNonNull(key, "key");
        this.threshold = Math.max(1, threshold);
        this.resetTimeoutMs = Math.max(0L, resetTimeoutMs);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String getKey() {
        return key;
    }

    /**
     * Returns true when a call may proceed. While open, returns true only for the single trial caller
     * after the reset timeout; that caller must report the outcome through
     * {@link #recordSuccess()} or {@link #recordFailure()}.
     */
    public synchronized boolean tryAcquire() {
        if (!open) return true;
        if (trialInFlight) return false;
        if (resetTimeoutElapsed()) {
            trialInFlight = true;
            return true;
        }
        return false;
    }

    /** True when a call would currently be rejected. Does not acquire the trial. */
    public synchronized boolean isOpen() {
        return open && (trialInFlight || !resetTimeoutElapsed());
    }

    public synchronized CircuitState getState() {
        if (!open) return CircuitState.CLOSED;
        return trialInFlight || resetTimeoutElapsed() ? CircuitState.HALF_OPEN : CircuitState.OPEN;
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        open = false;
        trialInFlight = false;
    }

    /**
     * Records one failed provider call.
     *
     * @return true if this failure opened (or re-opened) the breaker
     */
    public synchronized boolean recordFailure() {
        consecutiveFailures++;
        lastFailureTime = clock.millis();
        if (trialInFlight) {
            trialInFlight = false;
            open = true;
            return true;
        }
        if (!open && consecutiveFailures >= threshold) {
            open = true;
            return true;
        }
        return false;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /** Epoch millis of the last recorded failure; 0 when none. */
    public synchronized long getLastFailureTime() {
        return lastFailureTime;
    }

    private boolean resetTimeoutElapsed() {
        return clock.millis() - lastFailureTime >= resetTimeoutMs;
    }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{key=" + key + ", state=" + getState() + ", consecutiveFailures=" + consecutiveFailures + "}";
    }
}
