package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.model.PrStatus;

import java.io.IOException;
import java.util.Optional;

/**
 * Looks up the pull/merge request for a branch on the hosting platform.
 * No implementation ships with the engine; register a bean to enable it.
 */
public interface PullRequestStatusProvider {

    Optional<PrStatus> findForBranch(String repoPath, String branchName) throws IOException;
}
