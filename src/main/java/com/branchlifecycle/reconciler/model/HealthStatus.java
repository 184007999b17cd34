package com.branchlifecycle.reconciler.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL,
    DANGER;

    public static HealthStatus fromScore(int score) {
        if (score >= 80) return HEALTHY;
        if (score >= 60) return WARNING;
        if (score >= 40) return CRITICAL;
        return DANGER;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
