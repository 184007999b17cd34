package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.exception.BackendUnavailableException;
import com.branchlifecycle.reconciler.model.DeletionOutcome;
import com.branchlifecycle.reconciler.model.RecoveryEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Log-then-delete: each branch gets a recovery entry with its tip commit before it is
 * force-deleted. One failing branch never stops the rest of the batch.
 */
@Slf4j
@Service
public class BranchDeletionService {

    private final GitService gitService;
    private final RecoveryLogService recoveryLog;
    private Clock clock = Clock.systemUTC();

    public BranchDeletionService(GitService gitService, RecoveryLogService recoveryLog) {
        this.gitService = gitService;
        this.recoveryLog = recoveryLog;
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    public DeletionOutcome deleteAll(String repoPath, Collection<String> branchNames, String reason) {
        if (branchNames.isEmpty()) {
            return DeletionOutcome.NONE;
        }
        String deletedBy = currentUser(repoPath);
        List<String> deleted = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (String branch : branchNames) {
            try {
                String hash = gitService.commitHash(repoPath, branch);
                recoveryLog.add(repoPath, RecoveryEntry.builder()
                    .branchName(branch)
                    .commitHash(hash)
                    .deletedAt(clock.instant())
                    .deletedBy(deletedBy)
                    .reason(reason)
                    .build());
                gitService.deleteBranch(repoPath, branch);
                deleted.add(branch);
                log.info("Deleted {} ({}) in {}: {}", branch, hash, repoPath, reason);
            } catch (BackendUnavailableException | RuntimeException e) {
                failed.add(branch);
                log.warn("Failed to delete {} in {}: {}", branch, repoPath, e.getMessage());
            }
        }
        return new DeletionOutcome(List.copyOf(deleted), List.copyOf(failed));
    }

    private String currentUser(String repoPath) {
        try {
            String user = gitService.userName(repoPath);
            return user.isEmpty() ? null : user;
        } catch (BackendUnavailableException e) {
            return null;
        }
    }
}
