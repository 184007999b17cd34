package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.model.RepositoryConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.*;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.nio.file.StandardWatchEventKinds.*;

@Slf4j
@Service
public class GitEventWatcher {

    static final String FETCH_HEAD = "FETCH_HEAD";
    static final String ORIG_HEAD = "ORIG_HEAD";

    @Value("${reconciler.watch.enabled:true}")
    private boolean watchEnabled = true;

    private final ConfigLoaderService configLoader;
    private final GoneBranchDetector goneDetector;
    private final CleanupRuleEvaluator cleanupEvaluator;
    private final Map<WatchKey, String> watchedRepos = new ConcurrentHashMap<>();

    private WatchService watchService;
    private Thread watchThread;

    public GitEventWatcher(ConfigLoaderService configLoader,
                           GoneBranchDetector goneDetector,
                           CleanupRuleEvaluator cleanupEvaluator) {
        this.configLoader = configLoader;
        this.goneDetector = goneDetector;
        this.cleanupEvaluator = cleanupEvaluator;
    }

    public void setWatchEnabled(boolean watchEnabled) {
        this.watchEnabled = watchEnabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        goneDetector.initialize();
        if (!watchEnabled) {
            log.info("Git event watching disabled");
            return;
        }
        try {
            watchService = FileSystems.getDefault().newWatchService();
        } catch (IOException e) {
            log.error("Cannot create watch service, git events will only arrive through the API", e);
            return;
        }
        for (RepositoryConfig config : configLoader.getAllConfigs()) {
            register(config.getPath());
        }
        watchThread = new Thread(this::watchLoop, "git-event-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
    }

    /**
     * Dispatches one named git event. {@code fetch} reaches both consumers; {@code merge} and
     * {@code pull} only the cleanup evaluator.
     */
    public boolean dispatch(String repoPath, String eventType) {
        switch (eventType.toLowerCase()) {
            case "fetch":
                goneDetector.onFetchCompleted(repoPath);
                cleanupEvaluator.onEventTriggered(repoPath);
                return true;
            case "merge":
            case "pull":
                cleanupEvaluator.onEventTriggered(repoPath);
                return true;
            default:
                log.warn("Ignoring unknown git event '{}' for {}", eventType, repoPath);
                return false;
        }
    }

    void onFileChanged(String repoPath, String fileName) {
        if (FETCH_HEAD.equals(fileName)) {
            dispatch(repoPath, "fetch");
        } else if (ORIG_HEAD.equals(fileName)) {
            dispatch(repoPath, "merge");
        }
    }

    @PreDestroy
    public void stop() {
        if (watchThread != null) {
            watchThread.interrupt();
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.debug("Closing watch service: {}", e.getMessage());
            }
        }
    }

    private void register(String repoPath) {
        Path gitDir = Paths.get(repoPath, ".git");
        if (!Files.isDirectory(gitDir)) {
            log.warn("No .git directory at {}, not watching", repoPath);
            return;
        }
        try {
            WatchKey key = gitDir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY);
            watchedRepos.put(key, repoPath);
            log.info("Watching {} for git events", gitDir);
        } catch (IOException e) {
            log.warn("Cannot watch {}: {}", gitDir, e.getMessage());
        }
    }

    private void watchLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            String repoPath = watchedRepos.get(key);
            for (WatchEvent<?> event : key.pollEvents()) {
                if (repoPath != null && event.context() instanceof Path changed) {
                    onFileChanged(repoPath, changed.getFileName().toString());
                }
            }
            if (!key.reset()) {
                watchedRepos.remove(key);
            }
        }
    }
}
