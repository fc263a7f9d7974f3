package com.docflow.engine.step;

import com.docflow.observability.TraceContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Where a step runs: its trace span, the composite step ids enclosing it (outermost first) and the
 * flows on the trigger call stack (root first).
 */
public record FlowScope(TraceContext trace, List<String> flowPath, List<String> callStack) {

    public FlowScope {
        flowPath = List.copyOf(flowPath);
        callStack = List.copyOf(callStack);
    }

    public static FlowScope root(TraceContext trace, String flowId) {
        return new FlowScope(trace, List.of(), List.of(flowId));
    }

    /** Scope for the sub-flow of composite step {@code stepId}. */
    public FlowScope nested(String stepId) {
        List<String> path = new ArrayList<>(flowPath);
        path.add(stepId);
        return new FlowScope(trace, path, callStack);
    }

    /** Scope after a trigger entered {@code flowId}. */
    public FlowScope enter(String flowId) {
        List<String> stack = new ArrayList<>(callStack);
        stack.add(flowId);
        return new FlowScope(trace, flowPath, stack);
    }

    public FlowScope withTrace(TraceContext value) {
        return new FlowScope(value, flowPath, callStack);
    }
}
