package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GoneBranchDetectorTest {

    private static final String REPO = "/repos/app";

    private BranchSnapshotService snapshotService;
    private BranchDeletionService deletionService;
    private ConfigLoaderService configLoader;
    private ReconciliationPresenter presenter;
    private ReconciliationEventLoop eventLoop;
    private GoneBranchDetector detector;
    private RepositoryConfig config;

    @BeforeEach
    void setUp() {
        snapshotService = mock(BranchSnapshotService.class);
        deletionService = mock(BranchDeletionService.class);
        configLoader = mock(ConfigLoaderService.class);
        presenter = mock(ReconciliationPresenter.class);
        eventLoop = new ReconciliationEventLoop();
        detector = new GoneBranchDetector(snapshotService, deletionService, configLoader, presenter, eventLoop, 20);

        config = RepositoryConfig.defaults(REPO);
        when(configLoader.getConfigForPath(REPO)).thenReturn(config);
        when(configLoader.getAllConfigs()).thenReturn(List.of(config));
        when(deletionService.deleteAll(eq(REPO), anyCollection(), eq("remote gone")))
            .thenAnswer(inv -> new DeletionOutcome(List.copyOf(inv.<Collection<String>>getArgument(1)), List.of()));
    }

    @AfterEach
    void tearDown() {
        detector.dispose();
        eventLoop.shutdown();
    }

    @Test
    void shouldReportOnlyNewlyGoneBranches() {
        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of(gone("feature/a"))));
        detector.initialize();

        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of(gone("feature/a"), gone("feature/b"))));
        List<BranchSnapshot> first = detector.detect(config);
        List<BranchSnapshot> second = detector.detect(config);

        assertEquals(List.of("feature/b"), names(first));
        assertTrue(second.isEmpty());
        assertEquals(Set.of("feature/a", "feature/b"), detector.knownGone(REPO));
    }

    @Test
    void shouldIgnoreCurrentBranchEvenWhenGone() {
        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of(
            gone("feature/a").toBuilder().currentBranch(true).build())));

        assertTrue(detector.detect(config).isEmpty());
        assertTrue(detector.knownGone(REPO).isEmpty());
    }

    @Test
    void shouldForgetBranchesThatAreNoLongerGone() {
        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of(gone("feature/a"))));
        detector.detect(config);

        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of()));
        detector.detect(config);

        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of(gone("feature/a"))));
        assertEquals(List.of("feature/a"), names(detector.detect(config)));
    }

    @Test
    void shouldKeepKnownGoneSetWhenSnapshotIsUnavailable() {
        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of(gone("feature/a"))));
        assertEquals(List.of("feature/a"), names(detector.detect(config)));

        when(snapshotService.tryBuild(config)).thenReturn(Optional.empty());
        assertTrue(detector.detect(config).isEmpty());
        assertEquals(Set.of("feature/a"), detector.knownGone(REPO));

        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of(gone("feature/a"))));
        assertTrue(detector.detect(config).isEmpty());
    }

    @Test
    void shouldNotAutoDeleteSeededBranchesAfterBackendOutage() throws Exception {
        config.setGoneBranchAction(GoneBranchAction.AUTO_DELETE);
        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of(gone("feature/kept"))));
        detector.initialize();

        when(snapshotService.tryBuild(config)).thenReturn(Optional.empty());
        detector.detect(config);
        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of(gone("feature/kept"))));
        DeletionOutcome outcome = detector.respond(config, detector.detect(config)).get(5, TimeUnit.SECONDS);

        assertTrue(outcome.isEmpty());
        verify(deletionService, never()).deleteAll(anyString(), anyCollection(), anyString());
    }

    @Test
    void shouldLeaveRepositoryUnseededWhenStartupSnapshotFails() {
        when(snapshotService.tryBuild(config)).thenReturn(Optional.empty());

        detector.initialize();

        assertTrue(detector.knownGone(REPO).isEmpty());
    }

    @Test
    void shouldDeleteDirectlyInAutoDeleteMode() throws Exception {
        config.setGoneBranchAction(GoneBranchAction.AUTO_DELETE);
        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of(gone("feature/a"))));
        List<BranchSnapshot> newlyGone = detector.detect(config);

        DeletionOutcome outcome = detector.respond(config, newlyGone).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("feature/a"), outcome.getDeleted());
        verify(presenter).notify(REPO, "Orphaned branch cleanup: deleted 1");
        verify(presenter, never()).offerGoneBranches(anyString(), anyString(), anyList());
        assertTrue(detector.knownGone(REPO).isEmpty());
    }

    @Test
    void shouldOnlyNotifyInNotifyOnlyMode() throws Exception {
        config.setGoneBranchAction(GoneBranchAction.NOTIFY_ONLY);

        DeletionOutcome outcome = detector.respond(config, List.of(gone("feature/a"))).get(5, TimeUnit.SECONDS);

        assertTrue(outcome.isEmpty());
        verify(presenter).notify(REPO, "Branch \"feature/a\" is orphaned: its remote was deleted");
        verify(deletionService, never()).deleteAll(anyString(), anyCollection(), anyString());
    }

    @Test
    void shouldDeleteAllWhenUserChoosesCleanAll() throws Exception {
        when(presenter.offerGoneBranches(eq(REPO), anyString(), anyList()))
            .thenReturn(CompletableFuture.completedFuture(GoneChoice.CLEAN_ALL));

        DeletionOutcome outcome = detector.respond(config, List.of(gone("feature/a"), gone("feature/b")))
            .get(5, TimeUnit.SECONDS);

        verify(presenter).offerGoneBranches(eq(REPO),
            eq("2 branches are orphaned: their remotes were deleted"), anyList());
        assertEquals(List.of("feature/a", "feature/b"), outcome.getDeleted());
    }

    @Test
    void shouldDeleteOnlyBranchesLeftCheckedInPreview() throws Exception {
        when(presenter.offerGoneBranches(eq(REPO), anyString(), anyList()))
            .thenReturn(CompletableFuture.completedFuture(GoneChoice.PREVIEW));
        when(presenter.previewDeletion(eq(REPO), eq(ProposalKind.GONE_PREVIEW), anyString(), anyList()))
            .thenReturn(CompletableFuture.completedFuture(List.of("feature/b")));

        DeletionOutcome outcome = detector.respond(config, List.of(gone("feature/a"), gone("feature/b")))
            .get(5, TimeUnit.SECONDS);

        verify(deletionService).deleteAll(REPO, List.of("feature/b"), "remote gone");
        assertEquals(List.of("feature/b"), outcome.getDeleted());
    }

    @Test
    void shouldNotRepeatDismissedAlert() throws Exception {
        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of(gone("feature/a"))));
        when(presenter.offerGoneBranches(eq(REPO), anyString(), anyList()))
            .thenReturn(CompletableFuture.completedFuture(GoneChoice.DISMISS));

        DeletionOutcome outcome = detector.respond(config, detector.detect(config)).get(5, TimeUnit.SECONDS);

        assertTrue(outcome.isEmpty());
        verify(deletionService, never()).deleteAll(anyString(), anyCollection(), anyString());
        assertTrue(detector.detect(config).isEmpty());
    }

    @Test
    void shouldTreatFailedPromptAsNoAction() throws Exception {
        when(presenter.offerGoneBranches(eq(REPO), anyString(), anyList()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("presenter closed")));

        DeletionOutcome outcome = detector.respond(config, List.of(gone("feature/a"))).get(5, TimeUnit.SECONDS);

        assertTrue(outcome.isEmpty());
    }

    @Test
    void shouldCoalesceBurstOfFetchEvents() throws Exception {
        when(snapshotService.tryBuild(config)).thenReturn(Optional.of(List.of()));

        detector.onFetchCompleted(REPO);
        detector.onFetchCompleted(REPO);
        detector.onFetchCompleted(REPO);

        verify(snapshotService, timeout(2000)).tryBuild(config);
        Thread.sleep(100);
        verify(snapshotService, times(1)).tryBuild(config);
    }

    private static BranchSnapshot gone(String name) {
        return BranchSnapshot.builder()
            .name(name)
            .hasRemote(true)
            .remoteGone(true)
            .trackingRef("origin/" + name)
            .build();
    }

    private static List<String> names(List<BranchSnapshot> snapshots) {
        return snapshots.stream().map(BranchSnapshot::getName).toList();
    }
}
