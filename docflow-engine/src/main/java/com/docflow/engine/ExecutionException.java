package com.docflow.engine;

import java.util.List;

/**
 * A flow run failed. {@code stepId} is the step that failed; {@code flowPath} lists the enclosing composite
 * step ids, outermost first, when the failure happened inside a sub-flow.
 */
public final class ExecutionException extends RuntimeException {

    private final String stepId;
    private final List<String> flowPath;

    public ExecutionException(String stepId, List<String> flowPath, Throwable cause) {
        this(stepId, flowPath, cause != null ? cause.getMessage() : null, cause);
    }

    public ExecutionException(String stepId, List<String> flowPath, String message, Throwable cause) {
        super(format(stepId, flowPath, message), cause);
        this.stepId = stepId;
        this.flowPath = flowPath != null ? List.copyOf(flowPath) : List.of();
    }

    private static String format(String stepId, List<String> flowPath, String message) {
        String where = flowPath == null || flowPath.isEmpty()
                ? stepId
                : String.join(" > ", flowPath) + " > " + stepId;
        return "Step '" + where + "' failed: " + message;
    }

    public String getStepId() {
        return stepId;
    }

    public List<String> getFlowPath() {
        return flowPath;
    }
}
