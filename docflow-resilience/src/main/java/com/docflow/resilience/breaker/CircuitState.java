package com.docflow.resilience.breaker;

public enum CircuitState {
    /** Calls pass. */
    CLOSED,
    /** Calls are rejected until the reset timeout has elapsed since the last failure. */
    OPEN,
    /** Reset timeout elapsed: one trial call is (or may be) in flight. */
    HALF_OPEN
}
