package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Presenter backed by the REST API: proposals wait here until a client posts a decision.
 * A newer proposal of the same kind for the same repository supersedes the older one,
 * which resolves as Dismiss / nothing selected. Orphaned-branch and cleanup-rule previews are
 * different kinds and never supersede each other.
 */
@Slf4j
@Service
public class ProposalService implements ReconciliationPresenter {

    private final SlackService slackService;
    private final ConfigLoaderService configLoader;
    private final Map<String, PendingProposal> proposals = new ConcurrentHashMap<>();

    public ProposalService(SlackService slackService, ConfigLoaderService configLoader) {
        this.slackService = slackService;
        this.configLoader = configLoader;
    }

    @Override
    public CompletableFuture<GoneChoice> offerGoneBranches(String repoPath, String summary,
                                                           List<BranchSnapshot> branches) {
        CompletableFuture<GoneChoice> choice = new CompletableFuture<>();
        PendingProposal proposal = register(PendingProposal.builder()
            .repoPath(repoPath)
            .kind(ProposalKind.GONE_BRANCHES)
            .message(summary)
            .branches(describe(branches))
            .choice(choice)
            .build());
        announce(proposal, "Reply with clean_all, preview or dismiss");
        return choice;
    }

    @Override
    public CompletableFuture<List<String>> previewDeletion(String repoPath, ProposalKind kind, String title,
                                                           List<BranchSnapshot> candidates) {
        if (kind == ProposalKind.GONE_BRANCHES) {
            throw new IllegalArgumentException("Not a preview kind: " + kind);
        }
        CompletableFuture<List<String>> selection = new CompletableFuture<>();
        PendingProposal proposal = register(PendingProposal.builder()
            .repoPath(repoPath)
            .kind(kind)
            .message(title)
            .branches(describe(candidates))
            .selection(selection)
            .build());
        announce(proposal, "All branches are pre-selected; post the ones to keep unchecked");
        return selection;
    }

    @Override
    public void notify(String repoPath, String message) {
        log.info("[{}] {}", repoPath, message);
        slackService.postMessage(channelFor(repoPath), message);
    }

    public List<PendingProposal> pending() {
        return proposals.values().stream()
            .sorted(Comparator.comparing(PendingProposal::getCreatedAt))
            .toList();
    }

    public Optional<PendingProposal> find(String id) {
        return Optional.ofNullable(proposals.get(id));
    }

    public boolean answerGone(String id, GoneChoice choice) {
        PendingProposal proposal = proposals.get(id);
        if (proposal == null || proposal.getKind() != ProposalKind.GONE_BRANCHES) {
            return false;
        }
        proposals.remove(id);
        return proposal.getChoice().complete(choice);
    }

    /**
     * Completes a preview with the selected names; names that were not proposed are ignored.
     */
    public boolean answerSelection(String id, Collection<String> selected) {
        PendingProposal proposal = proposals.get(id);
        if (proposal == null || proposal.getSelection() == null) {
            return false;
        }
        Set<String> chosen = new HashSet<>(selected);
        List<String> kept = proposal.getBranches().stream().filter(chosen::contains).toList();
        proposals.remove(id);
        return proposal.getSelection().complete(kept);
    }

    private PendingProposal register(PendingProposal proposal) {
        proposals.values().stream()
            .filter(p -> p.getRepoPath().equals(proposal.getRepoPath()) && p.getKind() == proposal.getKind())
            .toList()
            .forEach(this::supersede);

        proposal.setId(UUID.randomUUID().toString().substring(0, 8));
        proposal.setCreatedAt(Instant.now());
        proposals.put(proposal.getId(), proposal);
        return proposal;
    }

    private void supersede(PendingProposal stale) {
        if (proposals.remove(stale.getId()) == null) return;
        log.debug("Proposal {} superseded", stale.getId());
        if (stale.getChoice() != null) stale.getChoice().complete(GoneChoice.DISMISS);
        if (stale.getSelection() != null) stale.getSelection().complete(List.of());
    }

    private void announce(PendingProposal proposal, String instructions) {
        String message = String.format("*%s*\n%s\n%s (proposal %s)",
            proposal.getMessage(),
            String.join("\n", proposal.getBranches().stream().map(b -> "• " + b).toList()),
            instructions,
            proposal.getId());
        notify(proposal.getRepoPath(), message);
    }

    private List<String> describe(List<BranchSnapshot> branches) {
        return branches.stream().map(BranchSnapshot::getName).toList();
    }

    private String channelFor(String repoPath) {
        return configLoader.getConfigForPath(repoPath).getSlackChannel();
    }
}
