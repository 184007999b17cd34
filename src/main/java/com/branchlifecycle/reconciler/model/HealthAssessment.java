package com.branchlifecycle.reconciler.model;

import lombok.Value;

@Value
public class HealthAssessment {
    int score;
    HealthStatus status;
    String reason;
}
