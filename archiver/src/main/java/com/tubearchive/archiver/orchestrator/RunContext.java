package com.tubearchive.archiver.orchestrator;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Results collected during one run. Copy completions append from worker
 * threads, so both lists are safe for concurrent appends. Also tracks which
 * videos were handed to a copy this run, since their ledger rows are only
 * written once the copy finishes.
 */
public class RunContext {

    private final Instant startedAt;
    private final List<String> succeeded = new CopyOnWriteArrayList<>();
    private final List<String> failed = new CopyOnWriteArrayList<>();
    private final Set<String> dispatched = ConcurrentHashMap.newKeySet();

    public RunContext() {
        this(Instant.now());
    }

    RunContext(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public void recordSuccess(String displayName) {
        succeeded.add(displayName);
    }

    public void recordFailure(String displayName) {
        failed.add(displayName);
    }

    /**
     * @return false if the video was already handed to a copy this run
     */
    public boolean markDispatched(String videoId) {
        return dispatched.add(videoId);
    }

    public boolean isDispatched(String videoId) {
        return dispatched.contains(videoId);
    }

    public List<String> succeeded() {
        return List.copyOf(succeeded);
    }

    public List<String> failed() {
        return List.copyOf(failed);
    }

    public RunSummary summarize() {
        return new RunSummary(succeeded(), failed(),
                Duration.between(startedAt, Instant.now()).toMillis(), false);
    }
}
