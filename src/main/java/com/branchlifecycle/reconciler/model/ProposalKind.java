package com.branchlifecycle.reconciler.model;

public enum ProposalKind {
    GONE_BRANCHES,   // answered with a GoneChoice
    GONE_PREVIEW,    // orphaned branches, answered with the selected branch names
    DELETION_PREVIEW // cleanup rule matches, answered with the selected branch names
}
