package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.exception.BackendUnavailableException;
import com.branchlifecycle.reconciler.model.*;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the repository's enabled cleanup rules after git events and proposes the matching
 * branches for deletion as a pre-checked dry run.
 */
@Slf4j
@Service
public class CleanupRuleEvaluator {

    private final BranchSnapshotService snapshotService;
    private final CleanupRuleService ruleService;
    private final BranchDeletionService deletionService;
    private final ConfigLoaderService configLoader;
    private final GitService gitService;
    private final ReconciliationPresenter presenter;
    private final ReconciliationEventLoop eventLoop;
    private final Debouncer debouncer;

    public CleanupRuleEvaluator(BranchSnapshotService snapshotService,
                                CleanupRuleService ruleService,
                                BranchDeletionService deletionService,
                                ConfigLoaderService configLoader,
                                GitService gitService,
                                ReconciliationPresenter presenter,
                                ReconciliationEventLoop eventLoop,
                                @Value("${reconciler.debounce.millis:500}") long debounceMillis) {
        this.snapshotService = snapshotService;
        this.ruleService = ruleService;
        this.deletionService = deletionService;
        this.configLoader = configLoader;
        this.gitService = gitService;
        this.presenter = presenter;
        this.eventLoop = eventLoop;
        this.debouncer = new Debouncer(eventLoop, debounceMillis, this::runPass);
    }

    public void onEventTriggered(String repoPath) {
        debouncer.trigger(configLoader.getConfigForPath(repoPath).getPath());
    }

    /**
     * One full pass: match, filter, preview, then delete what the user left checked.
     */
    public CompletableFuture<DeletionOutcome> evaluate(RepositoryConfig config) {
        String repoPath = config.getPath();
        if (config.getAutoCleanupOnEvents().isEmpty()) {
            return CompletableFuture.completedFuture(DeletionOutcome.NONE);
        }
        List<CleanupRule> rules = ruleService.enabledRules(repoPath);
        if (rules.isEmpty()) {
            return CompletableFuture.completedFuture(DeletionOutcome.NONE);
        }

        List<BranchSnapshot> branches = snapshotService.build(config);
        if (branches.isEmpty()) {
            return CompletableFuture.completedFuture(DeletionOutcome.NONE);
        }

        List<CleanupRule> deleteRules = rules.stream().filter(r -> r.getAction() == RuleAction.DELETE).toList();
        List<CleanupRule> reportRules = rules.stream()
            .filter(r -> r.getAction() != null && r.getAction() != RuleAction.DELETE)
            .toList();

        List<BranchSnapshot> candidates = applyFilters(config, matchRules(branches, deleteRules));
        reportNonDeleteMatches(config, branches, reportRules, candidates);

        if (candidates.isEmpty()) {
            return CompletableFuture.completedFuture(DeletionOutcome.NONE);
        }

        String title = String.format("Auto-cleanup preview: %d branch%s matched cleanup rules",
            candidates.size(), candidates.size() == 1 ? "" : "es");
        String reason = "cleanup rule: " + String.join(", ", deleteRules.stream().map(CleanupRule::getName).toList());

        return presenter.previewDeletion(repoPath, ProposalKind.DELETION_PREVIEW, title, candidates)
            .thenApplyAsync(selected -> {
                Set<String> chosen = new HashSet<>(selected);
                List<String> toDelete = candidates.stream()
                    .map(BranchSnapshot::getName)
                    .filter(chosen::contains)
                    .toList();
                DeletionOutcome outcome = deletionService.deleteAll(repoPath, toDelete, reason);
                if (!outcome.isEmpty()) {
                    presenter.notify(repoPath, "Auto-cleanup: " + outcome.summary());
                }
                return outcome;
            }, eventLoop)
            .exceptionally(e -> {
                log.warn("Cleanup preview for {} failed: {}", repoPath, e.getMessage());
                return DeletionOutcome.NONE;
            });
    }

    /**
     * Union of every rule's matches, deduplicated by branch name in first-match order.
     * Rules are ORed; conditions inside one rule are ANDed.
     */
    public List<BranchSnapshot> matchRules(List<BranchSnapshot> branches, List<CleanupRule> rules) {
        Map<String, BranchSnapshot> union = new LinkedHashMap<>();
        for (CleanupRule rule : rules) {
            try {
                for (BranchSnapshot branch : ruleService.evaluate(branches, rule)) {
                    union.putIfAbsent(branch.getName(), branch);
                }
            } catch (RuntimeException e) {
                log.warn("Rule '{}' failed, continuing with the others: {}", rule.getName(), e.getMessage());
            }
        }
        return new ArrayList<>(union.values());
    }

    /**
     * Drops excluded names, then in team-safe mode keeps only the current git user's branches.
     * An unknown identity disables the team-safe filter rather than blocking the cleanup.
     */
    public List<BranchSnapshot> applyFilters(RepositoryConfig config, List<BranchSnapshot> candidates) {
        List<BranchSnapshot> result = candidates;
        if (!config.getExclusionPatterns().isEmpty()) {
            result = result.stream()
                .filter(b -> !BranchPatterns.isExcluded(b.getName(), config.getExclusionPatterns()))
                .toList();
        }

        if (config.isTeamSafeMode() && !result.isEmpty()) {
            Optional<String> currentUser = currentUser(config.getPath());
            if (currentUser.isPresent()) {
                String user = currentUser.get();
                result = result.stream().filter(b -> user.equals(b.getAuthor())).toList();
            }
        }
        return result;
    }

    @PreDestroy
    public void dispose() {
        debouncer.cancelAll();
    }

    private void reportNonDeleteMatches(RepositoryConfig config, List<BranchSnapshot> branches,
                                        List<CleanupRule> reportRules, List<BranchSnapshot> deleteCandidates) {
        Set<String> alreadyProposed = new HashSet<>();
        deleteCandidates.forEach(b -> alreadyProposed.add(b.getName()));

        for (CleanupRule rule : reportRules) {
            List<String> matched = applyFilters(config, matchRules(branches, List.of(rule))).stream()
                .map(BranchSnapshot::getName)
                .filter(name -> !alreadyProposed.contains(name))
                .toList();
            if (!matched.isEmpty()) {
                presenter.notify(config.getPath(), String.format("Rule '%s' (%s) matches %d branch%s: %s",
                    rule.getName(), rule.getAction().value(), matched.size(),
                    matched.size() == 1 ? "" : "es", String.join(", ", matched)));
            }
        }
    }

    private void runPass(String repoPath) {
        evaluate(configLoader.getConfigForPath(repoPath));
    }

    private Optional<String> currentUser(String repoPath) {
        try {
            String user = gitService.userName(repoPath);
            return user.isEmpty() ? Optional.empty() : Optional.of(user);
        } catch (BackendUnavailableException e) {
            log.warn("Team-safe filter skipped for {}: git user unknown ({})", repoPath, e.getMessage());
            return Optional.empty();
        }
    }
}
