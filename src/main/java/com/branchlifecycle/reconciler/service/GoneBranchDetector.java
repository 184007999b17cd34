package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.model.*;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Watches for local branches whose upstream disappeared after a fetch and reacts according to
 * the repository's gone-branch action.
 *
 * <p>Per repository it remembers which branches were already gone at the previous check, so
 * only the delta is ever reported. The remembered set is replaced on every completed pass, even when
 * nothing is reported, which keeps a failed or dismissed alert from repeating.
 */
@Slf4j
@Service
public class GoneBranchDetector {

    private final BranchSnapshotService snapshotService;
    private final BranchDeletionService deletionService;
    private final ConfigLoaderService configLoader;
    private final ReconciliationPresenter presenter;
    private final ReconciliationEventLoop eventLoop;
    private final Debouncer debouncer;

    private final Map<String, Set<String>> knownGone = new ConcurrentHashMap<>();

    public GoneBranchDetector(BranchSnapshotService snapshotService,
                              BranchDeletionService deletionService,
                              ConfigLoaderService configLoader,
                              ReconciliationPresenter presenter,
                              ReconciliationEventLoop eventLoop,
                              @Value("${reconciler.debounce.millis:500}") long debounceMillis) {
        this.snapshotService = snapshotService;
        this.deletionService = deletionService;
        this.configLoader = configLoader;
        this.presenter = presenter;
        this.eventLoop = eventLoop;
        this.debouncer = new Debouncer(eventLoop, debounceMillis, this::runPass);
    }

    /**
     * Seeds the remembered sets so branches already gone at startup are not reported as new.
     */
    public void initialize() {
        for (RepositoryConfig config : configLoader.getAllConfigs()) {
            seed(config);
        }
    }

    public void seed(RepositoryConfig config) {
        Optional<List<BranchSnapshot>> snapshot = snapshotService.tryBuild(config);
        if (snapshot.isEmpty()) {
            log.warn("Could not seed known gone branches for {}", config.getPath());
            return;
        }
        knownGone.put(config.getPath(), goneNames(snapshot.get()));
        log.debug("Seeded {} known gone branches for {}", knownGone.get(config.getPath()).size(), config.getPath());
    }

    public void onFetchCompleted(String repoPath) {
        debouncer.trigger(configLoader.getConfigForPath(repoPath).getPath());
    }

    public Set<String> knownGone(String repoPath) {
        return Set.copyOf(knownGone.getOrDefault(repoPath, Set.of()));
    }

    /**
     * Rebuilds the snapshot and returns the branches that became gone since the previous check.
     * An aborted snapshot reports nothing and leaves the remembered set as it was.
     */
    public List<BranchSnapshot> detect(RepositoryConfig config) {
        Optional<List<BranchSnapshot>> snapshot = snapshotService.tryBuild(config);
        if (snapshot.isEmpty()) {
            log.warn("Gone-branch check of {} skipped, snapshot unavailable", config.getPath());
            return List.of();
        }
        List<BranchSnapshot> gone = snapshot.get().stream()
            .filter(b -> b.isRemoteGone() && !b.isCurrentBranch())
            .toList();
        Set<String> previouslyKnown = knownGone.getOrDefault(config.getPath(), Set.of());

        List<BranchSnapshot> newlyGone = gone.stream()
            .filter(b -> !previouslyKnown.contains(b.getName()))
            .toList();

        knownGone.put(config.getPath(), goneNames(gone));
        return newlyGone;
    }

    public CompletableFuture<DeletionOutcome> respond(RepositoryConfig config, List<BranchSnapshot> newlyGone) {
        if (newlyGone.isEmpty()) {
            return CompletableFuture.completedFuture(DeletionOutcome.NONE);
        }
        String repoPath = config.getPath();
        String summary = newlyGone.size() == 1
            ? String.format("Branch \"%s\" is orphaned: its remote was deleted", newlyGone.get(0).getName())
            : String.format("%d branches are orphaned: their remotes were deleted", newlyGone.size());

        switch (config.getGoneBranchAction()) {
            case AUTO_DELETE:
                return CompletableFuture.completedFuture(delete(repoPath, names(newlyGone)));
            case NOTIFY_ONLY:
                presenter.notify(repoPath, summary);
                return CompletableFuture.completedFuture(DeletionOutcome.NONE);
            default:
                return presenter.offerGoneBranches(repoPath, summary, newlyGone)
                    .thenComposeAsync(choice -> onChoice(repoPath, choice, newlyGone), eventLoop)
                    .exceptionally(e -> {
                        log.warn("Gone-branch prompt for {} failed: {}", repoPath, e.getMessage());
                        return DeletionOutcome.NONE;
                    });
        }
    }

    @PreDestroy
    public void dispose() {
        debouncer.cancelAll();
    }

    private CompletableFuture<DeletionOutcome> onChoice(String repoPath, GoneChoice choice,
                                                        List<BranchSnapshot> newlyGone) {
        switch (choice) {
            case CLEAN_ALL:
                return CompletableFuture.completedFuture(delete(repoPath, names(newlyGone)));
            case PREVIEW:
                return presenter.previewDeletion(repoPath, ProposalKind.GONE_PREVIEW,
                        "Select orphaned branches to delete", newlyGone)
                    .thenApplyAsync(selected -> {
                        Set<String> chosen = new HashSet<>(selected);
                        return delete(repoPath, names(newlyGone).stream().filter(chosen::contains).toList());
                    }, eventLoop);
            default:
                log.info("Orphaned branches in {} dismissed: {}", repoPath, names(newlyGone));
                return CompletableFuture.completedFuture(DeletionOutcome.NONE);
        }
    }

    private void runPass(String repoPath) {
        RepositoryConfig config = configLoader.getConfigForPath(repoPath);
        List<BranchSnapshot> newlyGone = detect(config);
        if (newlyGone.isEmpty()) {
            return;
        }
        log.info("{} newly orphaned branches in {}", newlyGone.size(), repoPath);
        respond(config, newlyGone);
    }

    private DeletionOutcome delete(String repoPath, List<String> branches) {
        DeletionOutcome outcome = deletionService.deleteAll(repoPath, branches, "remote gone");
        Set<String> known = knownGone.get(repoPath);
        if (known != null) {
            outcome.getDeleted().forEach(known::remove);
        }
        if (!outcome.isEmpty()) {
            presenter.notify(repoPath, "Orphaned branch cleanup: " + outcome.summary());
        }
        return outcome;
    }

    private static Set<String> goneNames(List<BranchSnapshot> branches) {
        Set<String> names = ConcurrentHashMap.newKeySet();
        branches.stream()
            .filter(b -> b.isRemoteGone() && !b.isCurrentBranch())
            .forEach(b -> names.add(b.getName()));
        return names;
    }

    private static List<String> names(List<BranchSnapshot> branches) {
        return branches.stream().map(BranchSnapshot::getName).toList();
    }
}
