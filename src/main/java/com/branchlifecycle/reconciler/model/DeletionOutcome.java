package com.branchlifecycle.reconciler.model;

import lombok.Value;

import java.util.List;

@Value
public class DeletionOutcome {
    public static final DeletionOutcome NONE = new DeletionOutcome(List.of(), List.of());

    List<String> deleted;
    List<String> failed;

    public boolean isEmpty() {
        return deleted.isEmpty() && failed.isEmpty();
    }

    public String summary() {
        if (failed.isEmpty()) {
            return String.format("deleted %d", deleted.size());
        }
        return String.format("deleted %d, failed %d: %s",
            deleted.size(), failed.size(), String.join(", ", failed));
    }
}
