package com.docflow.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives listener failures. The default implementation logs them.
 */
@FunctionalInterface
public interface HookErrorHandler {

    void onHookError(HookError error);

    static HookErrorHandler logging() {
        Logger log = LoggerFactory.getLogger(HookErrorHandler.class);
        return error -> log.warn("Hook {} failed (trace {}): {}", error.hookName(), error.traceId(),
                error.error().getMessage(), error.error());
    }
}
