package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.model.BranchSnapshot;
import com.branchlifecycle.reconciler.model.GoneChoice;
import com.branchlifecycle.reconciler.model.ProposalKind;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The engine's only view of a user. It proposes, the presenter answers whenever the user does.
 */
public interface ReconciliationPresenter {

    /**
     * Offers Clean All / Preview / Dismiss for branches whose remote was just deleted.
     */
    CompletableFuture<GoneChoice> offerGoneBranches(String repoPath, String summary, List<BranchSnapshot> branches);

    /**
     * Shows a pre-checked list of deletion candidates and completes with the names left checked.
     * An empty list means nothing is deleted. Previews of different kinds for the same
     * repository are independent of each other.
     */
    CompletableFuture<List<String>> previewDeletion(String repoPath, ProposalKind kind, String title,
                                                    List<BranchSnapshot> candidates);

    void notify(String repoPath, String message);
}
