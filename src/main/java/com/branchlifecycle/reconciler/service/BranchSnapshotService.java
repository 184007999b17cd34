package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.exception.BackendUnavailableException;
import com.branchlifecycle.reconciler.model.*;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Service
public class BranchSnapshotService {

    private final GitService gitService;
    private final HealthClassifier healthClassifier;
    private final int batchSize;
    private final ExecutorService enrichmentPool;

    @Autowired(required = false)
    private PullRequestStatusProvider pullRequestStatusProvider;

    private Clock clock = Clock.systemUTC();

    public BranchSnapshotService(GitService gitService,
                                 HealthClassifier healthClassifier,
                                 @Value("${reconciler.enrichment.batch-size:10}") int batchSize) {
        this.gitService = gitService;
        this.healthClassifier = healthClassifier;
        this.batchSize = Math.max(1, batchSize);
        AtomicInteger counter = new AtomicInteger();
        this.enrichmentPool = Executors.newFixedThreadPool(this.batchSize, runnable -> {
            Thread thread = new Thread(runnable, "branch-enrichment-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    public void setPullRequestStatusProvider(PullRequestStatusProvider provider) {
        this.pullRequestStatusProvider = provider;
    }

    @PreDestroy
    public void shutdown() {
        enrichmentPool.shutdownNow();
    }

    /**
     * Returns an empty list when the backend cannot answer the questions every branch depends on.
     * Callers that keep state across passes should use {@link #tryBuild} to tell that apart from
     * a repository with no branches.
     */
    public List<BranchSnapshot> build(RepositoryConfig config) {
        return tryBuild(config).orElse(List.of());
    }

    /**
     * Empty when the pass was aborted.
     */
    public Optional<List<BranchSnapshot>> tryBuild(RepositoryConfig config) {
        try {
            return Optional.of(buildOrThrow(config));
        } catch (BackendUnavailableException e) {
            log.warn("Snapshot of {} aborted, backend unavailable: {}", config.getPath(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<BranchSnapshot> buildOrThrow(RepositoryConfig config) throws BackendUnavailableException {
        String repoPath = config.getPath();
        List<String> allBranches = gitService.listBranches(repoPath);
        if (allBranches.isEmpty()) {
            return List.of();
        }

        String currentBranch = currentBranchOrNone(repoPath);
        String baseBranch = gitService.baseBranch(repoPath);
        Set<String> mergedSet = gitService.mergedBranches(repoPath, baseBranch);

        Map<String, RefMetadata> refData = null;
        Map<String, TrackingInfo> tracking = null;
        try {
            refData = gitService.refMetadata(repoPath);
        } catch (BackendUnavailableException e) {
            log.warn("for-each-ref unavailable in {}, using per-branch queries: {}", repoPath, e.getMessage());
            tracking = gitService.trackingInfo(repoPath);
        }

        Set<String> protectedSet = new HashSet<>(config.getProtectedBranches());
        List<String> branchList = allBranches.stream()
            .filter(b -> !protectedSet.contains(b))
            .toList();

        List<String> activeBranches = branchList.stream()
            .filter(b -> !mergedSet.contains(b) && !b.equals(currentBranch))
            .toList();
        Map<String, AheadBehind> aheadBehind = fetchAheadBehind(repoPath, baseBranch, activeBranches);

        List<BranchSnapshot> snapshots = new ArrayList<>();
        for (String branch : branchList) {
            try {
                boolean fromRefs = refData != null && refData.containsKey(branch);
                RefMetadata meta = fromRefs ? refData.get(branch) : gitService.lastCommit(repoPath, branch);

                boolean hasRemote;
                boolean remoteGone;
                String trackingRef;
                if (fromRefs) {
                    hasRemote = meta.hasUpstream();
                    remoteGone = meta.isUpstreamGone();
                    trackingRef = meta.getUpstream();
                } else {
                    // lastCommit carries no upstream
                    if (tracking == null) {
                        tracking = gitService.trackingInfo(repoPath);
                    }
                    TrackingInfo info = tracking.get(branch);
                    hasRemote = info != null;
                    remoteGone = info != null && info.isGone();
                    trackingRef = info != null ? info.getRemoteRef() : null;
                }

                AheadBehind counts = aheadBehind.getOrDefault(branch, AheadBehind.ZERO);
                BranchSnapshot snapshot = BranchSnapshot.builder()
                    .name(branch)
                    .merged(mergedSet.contains(branch))
                    .currentBranch(branch.equals(currentBranch))
                    .daysOld(daysSince(meta.getCommitTimestamp()))
                    .ahead(counts.getAhead())
                    .behind(counts.getBehind())
                    .author(meta.getAuthor())
                    .hasRemote(hasRemote)
                    .remoteGone(remoteGone)
                    .trackingRef(trackingRef)
                    .linkedIssue(healthClassifier.extractIssue(branch).orElse(null))
                    .prStatus(lookupPullRequest(repoPath, branch))
                    .build();

                snapshots.add(healthClassifier.classify(snapshot, config.getStaleDays()));
            } catch (BackendUnavailableException | RuntimeException e) {
                log.warn("Skipping branch {} in {}: {}", branch, repoPath, e.getMessage());
            }
        }

        snapshots.sort(Comparator.comparingInt(BranchSnapshot::getHealthScore));
        return snapshots;
    }

    /**
     * Fans out rev-list calls in fixed-size batches; each batch is joined before the next starts.
     */
    private Map<String, AheadBehind> fetchAheadBehind(String repoPath, String baseBranch, List<String> branches) {
        Map<String, AheadBehind> result = new HashMap<>();
        for (int i = 0; i < branches.size(); i += batchSize) {
            List<String> batch = branches.subList(i, Math.min(i + batchSize, branches.size()));
            List<CompletableFuture<Map.Entry<String, AheadBehind>>> futures = batch.stream()
                .map(branch -> CompletableFuture
                    .supplyAsync(() -> Map.entry(branch, aheadBehindOrZero(repoPath, baseBranch, branch)),
                        enrichmentPool)
                    .exceptionally(e -> {
                        log.debug("ahead/behind unavailable for {}: {}", branch, e.getMessage());
                        return Map.entry(branch, AheadBehind.ZERO);
                    }))
                .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            futures.forEach(future -> {
                Map.Entry<String, AheadBehind> entry = future.join();
                result.put(entry.getKey(), entry.getValue());
            });
        }
        return result;
    }

    private AheadBehind aheadBehindOrZero(String repoPath, String baseBranch, String branch) {
        try {
            AheadBehind counts = gitService.aheadBehind(repoPath, baseBranch, branch);
            return counts != null ? counts : AheadBehind.ZERO;
        } catch (BackendUnavailableException | RuntimeException e) {
            log.debug("ahead/behind unavailable for {}: {}", branch, e.getMessage());
            return AheadBehind.ZERO;
        }
    }

    private String currentBranchOrNone(String repoPath) {
        try {
            return gitService.currentBranch(repoPath);
        } catch (BackendUnavailableException e) {
            log.warn("Current branch of {} unknown: {}", repoPath, e.getMessage());
            return "";
        }
    }

    private PrStatus lookupPullRequest(String repoPath, String branch) {
        if (pullRequestStatusProvider == null) {
            return null;
        }
        try {
            return pullRequestStatusProvider.findForBranch(repoPath, branch).orElse(null);
        } catch (IOException | RuntimeException e) {
            log.debug("PR status unavailable for {}: {}", branch, e.getMessage());
            return null;
        }
    }

    private int daysSince(long epochSeconds) {
        if (epochSeconds <= 0) {
            return 0;
        }
        long seconds = clock.instant().getEpochSecond() - epochSeconds;
        return (int) Math.max(0, Duration.ofSeconds(seconds).toDays());
    }
}
