package com.docflow.resilience;

/**
 * Waits between retry attempts. Replaced in tests so backoff does not block.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
