package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.exception.NameCollisionException;
import com.branchlifecycle.reconciler.exception.ObjectMissingException;
import com.branchlifecycle.reconciler.model.RecoveryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RecoveryLogServiceTest {

    private static final String REPO = "/repos/app";

    private GitService gitService;
    private RecoveryLogService recoveryLog;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        StateStore stateStore = new StateStore();
        stateStore.setDataPath(tempDir.toString());
        gitService = mock(GitService.class);
        recoveryLog = new RecoveryLogService(stateStore, gitService);
    }

    @Test
    void shouldKeepNewestFirst() {
        recoveryLog.add(REPO, entry("feature/a", "aaa111"));
        recoveryLog.add(REPO, entry("feature/b", "bbb222"));

        List<RecoveryEntry> entries = recoveryLog.list(REPO);

        assertEquals("feature/b", entries.get(0).getBranchName());
        assertEquals("feature/a", entries.get(1).getBranchName());
        assertEquals("feature/b", recoveryLog.mostRecent(REPO).orElseThrow().getBranchName());
    }

    @Test
    void shouldEvictOldestBeyondCap() {
        for (int i = 0; i < RecoveryLogService.MAX_ENTRIES + 5; i++) {
            recoveryLog.add(REPO, entry("branch-" + i, "hash" + i));
        }

        List<RecoveryEntry> entries = recoveryLog.list(REPO);

        assertEquals(RecoveryLogService.MAX_ENTRIES, entries.size());
        assertEquals("branch-54", entries.get(0).getBranchName());
        assertEquals("branch-5", entries.get(entries.size() - 1).getBranchName());
    }

    @Test
    void shouldSurviveRestartOfStore() {
        recoveryLog.add(REPO, entry("feature/a", "aaa111"));

        StateStore reopened = new StateStore();
        reopened.setDataPath(tempDir.toString());
        RecoveryLogService reloaded = new RecoveryLogService(reopened, gitService);

        RecoveryEntry entry = reloaded.list(REPO).get(0);
        assertEquals("aaa111", entry.getCommitHash());
        assertEquals(Instant.parse("2024-06-01T12:00:00Z"), entry.getDeletedAt());
    }

    @Test
    void shouldKeepLogsSeparatePerRepository() {
        recoveryLog.add(REPO, entry("feature/a", "aaa111"));

        assertTrue(recoveryLog.list("/repos/other").isEmpty());
        assertTrue(recoveryLog.mostRecent("/repos/other").isEmpty());
    }

    @Test
    void shouldRemoveOnlyExactNameAndHashMatch() {
        recoveryLog.add(REPO, entry("feature/a", "old111"));
        recoveryLog.add(REPO, entry("feature/a", "new222"));

        assertFalse(recoveryLog.remove(REPO, "feature/a", "missing"));
        assertTrue(recoveryLog.remove(REPO, "feature/a", "old111"));

        List<RecoveryEntry> entries = recoveryLog.list(REPO);
        assertEquals(1, entries.size());
        assertEquals("new222", entries.get(0).getCommitHash());
    }

    @Test
    void shouldClearLog() {
        recoveryLog.add(REPO, entry("feature/a", "aaa111"));

        recoveryLog.clear(REPO);

        assertTrue(recoveryLog.list(REPO).isEmpty());
    }

    @Test
    void shouldRestoreBranchAndDropEntry() throws Exception {
        recoveryLog.add(REPO, entry("feature/a", "aaa111"));
        when(gitService.objectExists(REPO, "aaa111")).thenReturn(true);
        when(gitService.branchExists(REPO, "feature/a")).thenReturn(false);

        recoveryLog.restore(REPO, "feature/a", "aaa111");

        verify(gitService).createBranchAt(REPO, "feature/a", "aaa111");
        assertTrue(recoveryLog.list(REPO).isEmpty());
    }

    @Test
    void shouldRefuseRestoreWhenCommitIsGone() throws Exception {
        recoveryLog.add(REPO, entry("feature/a", "aaa111"));
        when(gitService.objectExists(REPO, "aaa111")).thenReturn(false);

        ObjectMissingException e = assertThrows(ObjectMissingException.class,
            () -> recoveryLog.restore(REPO, "feature/a", "aaa111"));

        assertTrue(e.getMessage().contains("no longer in the repository"));
        verify(gitService, never()).createBranchAt(anyString(), anyString(), anyString());
        assertEquals(1, recoveryLog.list(REPO).size());
    }

    @Test
    void shouldNeverOverwriteExistingBranch() throws Exception {
        recoveryLog.add(REPO, entry("feature/a", "aaa111"));
        when(gitService.objectExists(REPO, "aaa111")).thenReturn(true);
        when(gitService.branchExists(REPO, "feature/a")).thenReturn(true);

        NameCollisionException e = assertThrows(NameCollisionException.class,
            () -> recoveryLog.restore(REPO, "feature/a", "aaa111"));

        assertEquals("feature/a", e.getBranchName());
        verify(gitService, never()).createBranchAt(anyString(), anyString(), anyString());
        assertEquals(1, recoveryLog.list(REPO).size());
    }

    private static RecoveryEntry entry(String branch, String hash) {
        return RecoveryEntry.builder()
            .branchName(branch)
            .commitHash(hash)
            .deletedAt(Instant.parse("2024-06-01T12:00:00Z"))
            .deletedBy("Ada")
            .reason("test")
            .build();
    }
}
