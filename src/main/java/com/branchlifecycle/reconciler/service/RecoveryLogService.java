package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.exception.BackendUnavailableException;
import com.branchlifecycle.reconciler.exception.NameCollisionException;
import com.branchlifecycle.reconciler.exception.ObjectMissingException;
import com.branchlifecycle.reconciler.model.RecoveryEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class RecoveryLogService {

    public static final int MAX_ENTRIES = 50;

    private static final TypeReference<List<RecoveryEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final StateStore stateStore;
    private final GitService gitService;

    public RecoveryLogService(StateStore stateStore, GitService gitService) {
        this.stateStore = stateStore;
        this.gitService = gitService;
    }

    public synchronized void add(String repoPath, RecoveryEntry entry) {
        List<RecoveryEntry> entries = load(repoPath);
        entries.add(0, entry);
        while (entries.size() > MAX_ENTRIES) {
            entries.remove(entries.size() - 1);
        }
        stateStore.put(key(repoPath), entries);
    }

    public synchronized List<RecoveryEntry> list(String repoPath) {
        return List.copyOf(load(repoPath));
    }

    public synchronized Optional<RecoveryEntry> mostRecent(String repoPath) {
        List<RecoveryEntry> entries = load(repoPath);
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(0));
    }

    /**
     * Removes the entry matching both name and hash; a name alone is not unique across recreations.
     */
    public synchronized boolean remove(String repoPath, String branchName, String commitHash) {
        List<RecoveryEntry> entries = load(repoPath);
        boolean removed = entries.removeIf(entry -> entry.matches(branchName, commitHash));
        if (removed) {
            stateStore.put(key(repoPath), entries);
        }
        return removed;
    }

    public synchronized void clear(String repoPath) {
        stateStore.put(key(repoPath), List.of());
    }

    /**
     * Recreates the branch at its recorded commit. Never overwrites an existing branch.
     */
    public void restore(String repoPath, String branchName, String commitHash)
            throws ObjectMissingException, NameCollisionException, BackendUnavailableException {
        if (!gitService.objectExists(repoPath, commitHash)) {
            throw new ObjectMissingException(branchName, commitHash);
        }
        if (gitService.branchExists(repoPath, branchName)) {
            throw new NameCollisionException(branchName, commitHash);
        }
        gitService.createBranchAt(repoPath, branchName, commitHash);
        remove(repoPath, branchName, commitHash);
        log.info("Restored {} at {} in {}", branchName, commitHash, repoPath);
    }

    private List<RecoveryEntry> load(String repoPath) {
        return new ArrayList<>(stateStore.get(key(repoPath), ENTRY_LIST, ArrayList::new));
    }

    private static String key(String repoPath) {
        return "recoveryLog:" + repoPath;
    }
}
