package com.docflow.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Artifacts, named outputs and metrics of one flow run. Append-only: every key is written once.
 * Thread-safe so ForEach workers can record into the same run.
 */
public final class ExecutionContext {

    private static final Object NULL = new Object();

    private final Map<String, Object> artifacts = new ConcurrentHashMap<>();
    private final Queue<String> artifactOrder = new ConcurrentLinkedQueue<>();
    private final Map<String, Object> outputs = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Queue<StepMetric> metrics = new ConcurrentLinkedQueue<>();

    /**
     * @throws IllegalStateException if {@code key} was already written in this run
     */
    public void putArtifact(String key, Object value) {
        if (artifacts.putIfAbsent(key, value != null ? value : NULL) != null) {
            throw new IllegalStateException("Artifact already written: " + key);
        }
        artifactOrder.add(key);
    }

    public Object getArtifact(String key) {
        Object v = artifacts.get(key);
        return v == NULL ? null : v;
    }

    public boolean hasArtifact(String key) {
        return artifacts.containsKey(key);
    }

    /** Snapshot in write order. */
    public Map<String, Object> getArtifacts() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (String key : artifactOrder) {
            snapshot.put(key, getArtifact(key));
        }
        return snapshot;
    }

    /**
     * @throws IllegalStateException if an output with this name was already recorded
     */
    public void putOutput(String name, Object value) {
        synchronized (outputs) {
            if (outputs.containsKey(name)) {
                throw new IllegalStateException("Output already recorded: " + name);
            }
            outputs.put(name, value);
        }
    }

    public Map<String, Object> getOutputs() {
        synchronized (outputs) {
            return new LinkedHashMap<>(outputs);
        }
    }

    public void addMetric(StepMetric metric) {
        metrics.add(metric);
    }

    /** Adds sub-flow metrics under {@code prefix}, marked nested. */
    public void addNestedMetrics(String prefix, List<StepMetric> nested) {
        for (StepMetric m : nested) {
            metrics.add(m.prefixed(prefix));
        }
    }

    public List<StepMetric> getMetrics() {
        return new ArrayList<>(metrics);
    }
}
