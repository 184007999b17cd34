package com.branchlifecycle.reconciler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GoneBranchAction {
    AUTO_DELETE("auto-delete"),
    NOTIFY_ONLY("notify-only"),
    PROMPT("prompt");

    private final String value;

    GoneBranchAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static GoneBranchAction fromValue(String value) {
        for (GoneBranchAction action : values()) {
            if (action.value.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown gone branch action: " + value);
    }
}
