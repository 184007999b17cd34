package com.branchlifecycle.reconciler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RuleAction {
    DELETE,
    ARCHIVE,
    NOTIFY;

    @JsonCreator
    public static RuleAction fromValue(String value) {
        return RuleAction.valueOf(value.trim().toUpperCase());
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
