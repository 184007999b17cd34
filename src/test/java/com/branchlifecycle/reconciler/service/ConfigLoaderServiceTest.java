package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.model.GoneBranchAction;
import com.branchlifecycle.reconciler.model.RepositoryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderServiceTest {

    private ConfigLoaderService configLoader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        configLoader = new ConfigLoaderService();
        configLoader.setConfigPath(tempDir.toString());
    }

    @Test
    void shouldLoadConfigFromYaml() throws Exception {
        write("app.yaml",
            "name: app",
            "path: /repos/app",
            "stale_days: 45",
            "protected_branches: [main, release]",
            "exclusion_patterns: [\"keep-*\"]",
            "team_safe_mode: true",
            "auto_cleanup_on_events: [merge]",
            "gone_branch_action: auto-delete",
            "slack_channel: C0123ABC");

        configLoader.loadConfigs();
        Optional<RepositoryConfig> config = configLoader.getConfigByName("app");

        assertTrue(config.isPresent());
        assertEquals(Path.of("/repos/app").toAbsolutePath().normalize().toString(), config.get().getPath());
        assertEquals(45, config.get().getStaleDays());
        assertEquals(List.of("main", "release"), config.get().getProtectedBranches());
        assertEquals(List.of("keep-*"), config.get().getExclusionPatterns());
        assertTrue(config.get().isTeamSafeMode());
        assertEquals(List.of("merge"), config.get().getAutoCleanupOnEvents());
        assertEquals(GoneBranchAction.AUTO_DELETE, config.get().getGoneBranchAction());
        assertEquals("C0123ABC", config.get().getSlackChannel());
    }

    @Test
    void shouldApplyDefaultsForOmittedKeys() throws Exception {
        write("minimal.yml", "name: minimal", "path: /repos/minimal");

        configLoader.loadConfigs();
        RepositoryConfig config = configLoader.getConfigByName("minimal").orElseThrow();

        assertEquals(30, config.getStaleDays());
        assertEquals(RepositoryConfig.DEFAULT_PROTECTED_BRANCHES, config.getProtectedBranches());
        assertEquals(List.of("fetch", "pull"), config.getAutoCleanupOnEvents());
        assertEquals(GoneBranchAction.PROMPT, config.getGoneBranchAction());
        assertFalse(config.isTeamSafeMode());
    }

    @Test
    void shouldRejectInvalidFilesAndKeepValidOnes() throws Exception {
        write("a-good.yaml", "name: good", "path: /repos/good");
        write("b-negative.yaml", "name: negative", "path: /repos/negative", "stale_days: -1");
        write("c-typo.yaml", "name: typo", "path: /repos/typo", "stale_dayz: 10");
        write("d-action.yaml", "name: action", "path: /repos/action", "gone_branch_action: explode");
        write("e-duplicate.yaml", "name: good", "path: /repos/other");

        configLoader.loadConfigs();

        assertEquals(1, configLoader.getAllConfigs().size());
        assertTrue(configLoader.getConfigByName("good").isPresent());
        assertTrue(configLoader.getConfigByName("negative").isEmpty());
        assertTrue(configLoader.getConfigByName("typo").isEmpty());
        assertTrue(configLoader.getConfigByName("action").isEmpty());
    }

    @Test
    void shouldFallBackToDefaultsForUnconfiguredPath() {
        configLoader.loadConfigs();

        RepositoryConfig config = configLoader.getConfigForPath("/repos/unknown/../unknown");

        assertEquals(Path.of("/repos/unknown").toAbsolutePath().normalize().toString(), config.getPath());
        assertEquals(30, config.getStaleDays());
        assertEquals(GoneBranchAction.PROMPT, config.getGoneBranchAction());
    }

    @Test
    void shouldHandleMissingDirectory() {
        configLoader.setConfigPath(tempDir.resolve("missing").toString());

        configLoader.loadConfigs();

        assertTrue(configLoader.getAllConfigs().isEmpty());
    }

    private void write(String fileName, String... lines) throws IOException {
        File file = tempDir.resolve(fileName).toFile();
        try (FileWriter writer = new FileWriter(file)) {
            for (String line : lines) {
                writer.write(line + "\n");
            }
        }
    }
}
