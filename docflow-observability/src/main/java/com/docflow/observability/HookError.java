package com.docflow.observability;

/**
 * A listener failure. Delivered to {@link HookErrorHandler}; never thrown into the pipeline.
 */
public record HookError(String hookName, Throwable error, long timestampMs, String traceId) {
}
