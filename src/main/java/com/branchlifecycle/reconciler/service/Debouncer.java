package com.branchlifecycle.reconciler.service;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Coalesces bursts of triggers per repository: each trigger cancels the pending run for that
 * repository and restarts the quiet period. Repositories never share a timer.
 */
@Slf4j
public class Debouncer {

    private final ReconciliationEventLoop eventLoop;
    private final long delayMillis;
    private final Consumer<String> action;
    private final Map<String, PendingRun> pending = new ConcurrentHashMap<>();

    public Debouncer(ReconciliationEventLoop eventLoop, long delayMillis, Consumer<String> action) {
        this.eventLoop = eventLoop;
        this.delayMillis = delayMillis;
        this.action = action;
    }

    public void trigger(String repoPath) {
        pending.compute(repoPath, (key, existing) -> {
            if (existing != null && existing.future.cancel(false)) {
                log.debug("Coalesced trigger for {}", key);
            }
            PendingRun run = new PendingRun();
            run.future = eventLoop.schedule(() -> fire(key, run), delayMillis);
            return run;
        });
    }

    public boolean isPending(String repoPath) {
        return pending.containsKey(repoPath);
    }

    public void cancelAll() {
        pending.values().forEach(run -> run.future.cancel(false));
        pending.clear();
    }

    private void fire(String repoPath, PendingRun run) {
        pending.remove(repoPath, run);
        action.accept(repoPath);
    }

    private static final class PendingRun {
        private ScheduledFuture<?> future;
    }
}
