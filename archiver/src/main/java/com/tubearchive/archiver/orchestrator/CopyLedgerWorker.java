package com.tubearchive.archiver.orchestrator;

import com.tubearchive.archiver.client.PlaylistSourceException;
import com.tubearchive.archiver.ledger.DownloadLedger;
import com.tubearchive.archiver.model.DownloadRecord;
import com.tubearchive.archiver.util.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.SQLException;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Copies finished files to their destination in the background so the next
 * extraction can start right away, then records the result. The ledger row is
 * written only after a successful copy; a failed copy leaves the video
 * eligible for the next run.
 */
public class CopyLedgerWorker implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CopyLedgerWorker.class);

    private final DownloadLedger ledger;
    private final ExecutorService executor;

    public CopyLedgerWorker(DownloadLedger ledger) {
        this(ledger, Executors.newCachedThreadPool(copyThreadFactory()));
    }

    CopyLedgerWorker(DownloadLedger ledger, ExecutorService executor) {
        this.ledger = ledger;
        this.executor = executor;
    }

    private static ThreadFactory copyThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "copy-worker-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }

    /**
     * Starts the copy and returns immediately. The returned future completes
     * after the completion step (summary entry, ledger row, playlist removal,
     * scratch cleanup) has run; it never completes exceptionally.
     */
    public CompletableFuture<CopyOutcome> dispatch(CopyJob job, RunContext context) {
        return CompletableFuture
                .supplyAsync(() -> copy(job), executor)
                .handle((outcome, error) -> {
                    CopyOutcome result = outcome != null
                            ? outcome
                            : CopyOutcome.failure(job.videoId(), job.destination(), String.valueOf(error));
                    complete(job, result, context);
                    return result;
                });
    }

    CopyOutcome copy(CopyJob job) {
        try {
            Path parent = job.destination().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(job.source(), job.destination(),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            return CopyOutcome.success(job.videoId(), job.destination());
        } catch (IOException e) {
            logger.error("[{}] Copy failed: {}", job.videoId(), e.getMessage(), e);
            return CopyOutcome.failure(job.videoId(), job.destination(), e.getMessage());
        }
    }

    void complete(CopyJob job, CopyOutcome outcome, RunContext context) {
        try {
            if (outcome.success()) {
                logger.info("[{}] Copy OK -> {}", job.videoId(), outcome.destination());
                context.recordSuccess(job.displayName());
                writeLedger(job, outcome);
                removeFromPlaylist(job);
            } else {
                logger.error("[{}] Copy FAILED: {}", job.videoId(), outcome.errorMessage());
                context.recordFailure(job.displayName());
            }
        } finally {
            FileTrees.deleteQuietly(job.scratchDir());
        }
    }

    private void writeLedger(CopyJob job, CopyOutcome outcome) {
        try {
            ledger.record(new DownloadRecord(job.videoId(), job.playlistId(), Instant.now(),
                    outcome.destination().toString()));
        } catch (SQLException e) {
            logger.error("[{}] Ledger insert failed; the video may be downloaded again next run",
                    job.videoId(), e);
        }
    }

    private void removeFromPlaylist(CopyJob job) {
        if (!job.removeAfterDownload() || job.entryId() == null || job.playlistSource() == null) {
            return;
        }
        try {
            job.playlistSource().removeItem(job.entryId());
        } catch (PlaylistSourceException e) {
            logger.error("[{}] Failed removing entry {} from playlist {}: {}",
                    job.videoId(), job.entryId(), job.playlistId(), e.getMessage());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warn("Copy workers still running after shutdown timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
