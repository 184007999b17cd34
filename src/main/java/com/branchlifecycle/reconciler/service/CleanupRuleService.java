package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.exception.InvalidPatternException;
import com.branchlifecycle.reconciler.exception.InvalidRuleException;
import com.branchlifecycle.reconciler.model.BranchSnapshot;
import com.branchlifecycle.reconciler.model.CleanupRule;
import com.branchlifecycle.reconciler.model.RuleConditions;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

@Slf4j
@Service
public class CleanupRuleService {

    private static final TypeReference<List<CleanupRule>> RULE_LIST = new TypeReference<>() {};

    private final StateStore stateStore;

    public CleanupRuleService(StateStore stateStore) {
        this.stateStore = stateStore;
    }

    public synchronized List<CleanupRule> list(String repoPath) {
        return List.copyOf(load(repoPath));
    }

    public List<CleanupRule> enabledRules(String repoPath) {
        return list(repoPath).stream().filter(CleanupRule::isEnabled).toList();
    }

    public synchronized void save(String repoPath, List<CleanupRule> rules) {
        stateStore.put(key(repoPath), rules);
    }

    /**
     * Validates and appends a rule, assigning an id when none is given.
     */
    public synchronized CleanupRule add(String repoPath, CleanupRule rule) throws InvalidRuleException {
        if (rule.getConditions() == null) {
            rule.setConditions(new RuleConditions());
        }
        if (rule.getAction() == null) {
            throw new InvalidRuleException("Rule action is required (delete, archive or notify)");
        }
        Integer olderThanDays = rule.getConditions().getOlderThanDays();
        if (olderThanDays != null && olderThanDays <= 0) {
            throw new InvalidRuleException("olderThanDays must be positive, was " + olderThanDays);
        }
        String pattern = rule.getConditions().getPattern();
        if (pattern != null && !pattern.isEmpty()) {
            BranchPatterns.compileSafely(pattern);
        }
        if (rule.getConditions().isEmpty()) {
            log.warn("Rule '{}' has no conditions and will match every non-current branch", rule.getName());
        }

        CleanupRule stored = rule.toBuilder()
            .id(rule.getId() == null || rule.getId().isBlank() ? UUID.randomUUID().toString() : rule.getId())
            .build();
        List<CleanupRule> rules = load(repoPath);
        rules.removeIf(existing -> existing.getId().equals(stored.getId()));
        rules.add(stored);
        save(repoPath, rules);
        return stored;
    }

    public synchronized Optional<CleanupRule> toggle(String repoPath, String ruleId) {
        List<CleanupRule> rules = load(repoPath);
        for (CleanupRule rule : rules) {
            if (rule.getId().equals(ruleId)) {
                rule.setEnabled(!rule.isEnabled());
                save(repoPath, rules);
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public synchronized boolean delete(String repoPath, String ruleId) {
        List<CleanupRule> rules = load(repoPath);
        boolean removed = rules.removeIf(rule -> rule.getId().equals(ruleId));
        if (removed) {
            save(repoPath, rules);
        }
        return removed;
    }

    /**
     * Branches satisfying every present condition of the rule. The current branch never matches.
     * A rule whose pattern is unsafe or malformed matches nothing.
     */
    public List<BranchSnapshot> evaluate(List<BranchSnapshot> branches, CleanupRule rule) {
        RuleConditions conditions = rule.getConditions() != null ? rule.getConditions() : new RuleConditions();

        Pattern pattern = null;
        if (conditions.getPattern() != null && !conditions.getPattern().isEmpty()) {
            try {
                pattern = BranchPatterns.compileSafely(conditions.getPattern());
            } catch (InvalidPatternException e) {
                log.warn("Skipping rule '{}': {}", rule.getName(), e.getMessage());
                return List.of();
            }
        }
        if (conditions.isEmpty()) {
            log.warn("Rule '{}' has no conditions; matching every non-current branch", rule.getName());
        }

        List<BranchSnapshot> matches = new ArrayList<>();
        for (BranchSnapshot branch : branches) {
            if (branch.isCurrentBranch()) continue;
            if (conditions.getMerged() != null && branch.isMerged() != conditions.getMerged()) continue;
            if (conditions.getOlderThanDays() != null && branch.getDaysOld() < conditions.getOlderThanDays()) continue;
            if (Boolean.TRUE.equals(conditions.getNoRemote()) && branch.isHasRemote()) continue;
            if (pattern != null && !BranchPatterns.matches(pattern, branch.getName())) continue;
            matches.add(branch);
        }
        return matches;
    }

    private List<CleanupRule> load(String repoPath) {
        return new ArrayList<>(stateStore.get(key(repoPath), RULE_LIST, ArrayList::new));
    }

    private static String key(String repoPath) {
        return "cleanupRules:" + repoPath;
    }
}
