package com.branchlifecycle.reconciler.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RepositoryConfig {
    public static final List<String> DEFAULT_PROTECTED_BRANCHES =
        List.of("main", "master", "develop", "dev", "staging", "production");

    private String name;
    private String path;

    // Health
    private int staleDays = 30;
    private List<String> protectedBranches = new ArrayList<>(DEFAULT_PROTECTED_BRANCHES);

    // Cleanup
    private List<String> exclusionPatterns = new ArrayList<>();
    private boolean teamSafeMode = false;
    private List<String> autoCleanupOnEvents = new ArrayList<>(List.of("fetch", "pull"));

    // Gone branches
    private GoneBranchAction goneBranchAction = GoneBranchAction.PROMPT;

    // Optional
    private String slackChannel;

    public static RepositoryConfig defaults(String path) {
        RepositoryConfig config = new RepositoryConfig();
        config.setPath(path);
        config.setName(path);
        return config;
    }

    /**
     * Checks the loaded values and returns the list of problems, empty when valid.
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (name == null || name.isBlank()) problems.add("name is required");
        if (path == null || path.isBlank()) problems.add("path is required");
        if (staleDays <= 0) problems.add("stale_days must be positive, was " + staleDays);
        if (goneBranchAction == null) problems.add("gone_branch_action is required");
        if (protectedBranches == null) problems.add("protected_branches must be a list");
        if (exclusionPatterns == null) problems.add("exclusion_patterns must be a list");
        if (autoCleanupOnEvents == null) problems.add("auto_cleanup_on_events must be a list");
        return problems;
    }
}
