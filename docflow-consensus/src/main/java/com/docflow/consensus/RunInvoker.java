package com.docflow.consensus;

/**
 * One consensus run. Called concurrently for different run indexes.
 */
@FunctionalInterface
public interface RunInvoker<T> {

    T run(int runIndex) throws Exception;
}
