package com.branchlifecycle.reconciler.controller;

import com.branchlifecycle.reconciler.exception.BackendUnavailableException;
import com.branchlifecycle.reconciler.exception.InvalidRuleException;
import com.branchlifecycle.reconciler.exception.NameCollisionException;
import com.branchlifecycle.reconciler.exception.ObjectMissingException;
import com.branchlifecycle.reconciler.model.CleanupRule;
import com.branchlifecycle.reconciler.model.RecoveryEntry;
import com.branchlifecycle.reconciler.model.RepositoryConfig;
import com.branchlifecycle.reconciler.service.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
@RestController
@RequestMapping("/repositories")
public class BranchController {

    private final ConfigLoaderService configLoader;
    private final BranchSnapshotService snapshotService;
    private final CleanupRuleService ruleService;
    private final RecoveryLogService recoveryLog;
    private final GitEventWatcher eventWatcher;

    public BranchController(ConfigLoaderService configLoader,
                            BranchSnapshotService snapshotService,
                            CleanupRuleService ruleService,
                            RecoveryLogService recoveryLog,
                            GitEventWatcher eventWatcher) {
        this.configLoader = configLoader;
        this.snapshotService = snapshotService;
        this.ruleService = ruleService;
        this.recoveryLog = recoveryLog;
        this.eventWatcher = eventWatcher;
    }

    @GetMapping
    public ResponseEntity<?> repositories() {
        return ResponseEntity.ok(configLoader.getAllConfigs());
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    @GetMapping("/{name}/branches")
    public ResponseEntity<?> branches(@PathVariable String name) {
        return withRepository(name, config -> ResponseEntity.ok(snapshotService.build(config)));
    }

    @GetMapping("/{name}/rules")
    public ResponseEntity<?> rules(@PathVariable String name) {
        return withRepository(name, config -> ResponseEntity.ok(ruleService.list(config.getPath())));
    }

    @PostMapping("/{name}/rules")
    public ResponseEntity<?> addRule(@PathVariable String name, @RequestBody CleanupRule rule) {
        Optional<RepositoryConfig> config = configLoader.getConfigByName(name);
        if (config.isEmpty()) {
            return unknownRepository(name);
        }
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(ruleService.add(config.get().getPath(), rule));
        } catch (InvalidRuleException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/{name}/rules/{id}/toggle")
    public ResponseEntity<?> toggleRule(@PathVariable String name, @PathVariable String id) {
        return withRepository(name, config -> ruleService.toggle(config.getPath(), id)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build()));
    }

    @DeleteMapping("/{name}/rules/{id}")
    public ResponseEntity<?> deleteRule(@PathVariable String name, @PathVariable String id) {
        return withRepository(name, config -> ruleService.delete(config.getPath(), id)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build());
    }

    @GetMapping("/{name}/recovery")
    public ResponseEntity<?> recovery(@PathVariable String name) {
        return withRepository(name, config -> ResponseEntity.ok(recoveryLog.list(config.getPath())));
    }

    @PostMapping("/{name}/recovery/restore")
    public ResponseEntity<?> restore(@PathVariable String name, @RequestBody Map<String, String> body) {
        Optional<RepositoryConfig> config = configLoader.getConfigByName(name);
        if (config.isEmpty()) {
            return unknownRepository(name);
        }
        return restoreEntry(config.get(), body.get("branchName"), body.get("commitHash"));
    }

    @PostMapping("/{name}/recovery/undo-last")
    public ResponseEntity<?> undoLast(@PathVariable String name) {
        Optional<RepositoryConfig> config = configLoader.getConfigByName(name);
        if (config.isEmpty()) {
            return unknownRepository(name);
        }
        Optional<RecoveryEntry> last = recoveryLog.mostRecent(config.get().getPath());
        if (last.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "No deleted branches to restore"));
        }
        return restoreEntry(config.get(), last.get().getBranchName(), last.get().getCommitHash());
    }

    @DeleteMapping("/{name}/recovery")
    public ResponseEntity<?> dismiss(@PathVariable String name, @RequestBody Map<String, String> body) {
        return withRepository(name, config ->
            recoveryLog.remove(config.getPath(), body.get("branchName"), body.get("commitHash"))
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{name}/recovery/all")
    public ResponseEntity<?> clearRecovery(@PathVariable String name) {
        return withRepository(name, config -> {
            recoveryLog.clear(config.getPath());
            return ResponseEntity.noContent().build();
        });
    }

    @PostMapping("/{name}/events/{type}")
    public ResponseEntity<?> event(@PathVariable String name, @PathVariable String type) {
        return withRepository(name, config -> eventWatcher.dispatch(config.getPath(), type)
            ? ResponseEntity.accepted().body(Map.of("status", "scheduled"))
            : ResponseEntity.badRequest().body(Map.of("error", "Unknown event type: " + type)));
    }

    private ResponseEntity<?> restoreEntry(RepositoryConfig config, String branchName, String commitHash) {
        if (branchName == null || commitHash == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "branchName and commitHash are required"));
        }
        try {
            recoveryLog.restore(config.getPath(), branchName, commitHash);
            return ResponseEntity.ok(Map.of("message", "Restored branch: " + branchName));
        } catch (ObjectMissingException e) {
            return ResponseEntity.status(HttpStatus.GONE).body(Map.of("error", e.getMessage()));
        } catch (NameCollisionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (BackendUnavailableException e) {
            log.warn("Restore of {} failed: {}", branchName, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Failed to restore " + branchName + ": git is unavailable"));
        }
    }

    private ResponseEntity<?> withRepository(String name,
                                             Function<RepositoryConfig, ResponseEntity<?>> action) {
        return configLoader.getConfigByName(name)
            .<ResponseEntity<?>>map(action)
            .orElseGet(() -> unknownRepository(name));
    }

    private ResponseEntity<?> unknownRepository(String name) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Unknown repository: " + name));
    }
}
