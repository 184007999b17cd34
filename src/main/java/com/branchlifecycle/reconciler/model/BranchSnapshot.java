package com.branchlifecycle.reconciler.model;

import lombok.Builder;
import lombok.Value;

/**
 * State of one local branch as seen during a single reconciliation pass.
 * Rebuilt wholesale on every pass and never persisted.
 */
@Value
@Builder(toBuilder = true)
public class BranchSnapshot {
    String name;
    boolean merged;
    boolean currentBranch;
    int daysOld;
    int ahead;
    int behind;
    String author;
    boolean hasRemote;
    boolean remoteGone;
    String trackingRef;
    String linkedIssue;
    int healthScore;
    HealthStatus healthStatus;
    String healthReason;
    PrStatus prStatus;
}
