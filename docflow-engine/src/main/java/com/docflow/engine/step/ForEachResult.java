package com.docflow.engine.step;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Artifact of a forEach step: item results in input order.
 */
public record ForEachResult(List<ItemResult> items, int successfulItems, int failedItems) {

    public ForEachResult {
        items = List.copyOf(items);
    }

    static ForEachResult of(List<ItemResult> items) {
        int ok = (int) items.stream().filter(ItemResult::isSuccess).count();
        return new ForEachResult(items, ok, items.size() - ok);
    }

    public int totalItems() {
        return items.size();
    }

    /** Outputs of successful items, in input order. */
    public List<Object> successfulOutputs() {
        return items.stream().filter(ItemResult::isSuccess).map(ItemResult::output).collect(Collectors.toList());
    }
}
