package com.tubearchive.archiver.orchestrator;

import com.tubearchive.archiver.client.AuthFailureException;
import com.tubearchive.archiver.client.PlaylistSource;
import com.tubearchive.archiver.client.PlaylistSourceException;
import com.tubearchive.archiver.config.ArchiverConfig;
import com.tubearchive.archiver.config.EnginePaths;
import com.tubearchive.archiver.config.PlaylistConfig;
import com.tubearchive.archiver.engine.ExtractionFailedException;
import com.tubearchive.archiver.engine.ExtractorFallbackEngine;
import com.tubearchive.archiver.ledger.DownloadLedger;
import com.tubearchive.archiver.media.ContainerConverter;
import com.tubearchive.archiver.media.MetadataEmbedder;
import com.tubearchive.archiver.model.PlaylistItem;
import com.tubearchive.archiver.model.VideoMetadata;
import com.tubearchive.archiver.notify.Notifier;
import com.tubearchive.archiver.util.FileNames;
import com.tubearchive.archiver.util.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs one archive pass: lock, then for every playlist and every video not
 * yet in the ledger extract, tag, convert and hand off to a background copy.
 * Extraction is strictly sequential; only copies overlap. All copies are
 * joined before the summary is built, the notification is sent, or the lock
 * is released.
 *
 * <p>A failure never stops the run. Playlists and videos that fail are
 * recorded in the summary and the run moves on.</p>
 */
public class RunCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(RunCoordinator.class);

    static final String DEFAULT_EXTENSION = "webm";

    private final ArchiverConfig config;
    private final EnginePaths paths;
    private final Map<String, PlaylistSource> sources;
    private final DownloadLedger ledger;
    private final ExtractorFallbackEngine engine;
    private final MetadataEmbedder embedder;
    private final ContainerConverter converter;
    private final CopyLedgerWorker copyWorker;
    private final Notifier notifier;

    public RunCoordinator(ArchiverConfig config, EnginePaths paths, Map<String, PlaylistSource> sources,
                          DownloadLedger ledger, ExtractorFallbackEngine engine, MetadataEmbedder embedder,
                          ContainerConverter converter, CopyLedgerWorker copyWorker, Notifier notifier) {
        this.config = config;
        this.paths = paths;
        this.sources = Map.copyOf(sources);
        this.ledger = ledger;
        this.engine = engine;
        this.embedder = embedder;
        this.converter = converter;
        this.copyWorker = copyWorker;
        this.notifier = notifier;
    }

    /**
     * Runs one pass over all configured playlists.
     *
     * @return the run summary, or {@link RunSummary#lockHeld()} if another run
     *         holds the lock
     */
    public RunSummary run() {
        Optional<RunLock> acquired;
        try {
            acquired = RunLock.tryAcquire(paths.lockFile());
        } catch (IOException e) {
            logger.error("Could not open lock file {}; skipping run", paths.lockFile(), e);
            return RunSummary.lockHeld();
        }
        if (acquired.isEmpty()) {
            logger.warn("Lock file held by another run; skipping run");
            return RunSummary.lockHeld();
        }

        try (RunLock ignored = acquired.get()) {
            RunContext context = new RunContext();

            try {
                ledger.ensureSchema();
            } catch (SQLException e) {
                logger.error("Failed to open download ledger", e);
                context.recordFailure("ledger (" + e.getMessage() + ")");
                return finish(context);
            }

            Map<String, PlaylistSource> usableSources = new HashMap<>(sources);
            List<CompletableFuture<CopyOutcome>> pendingCopies = new ArrayList<>();

            for (PlaylistConfig playlist : config.playlists()) {
                processPlaylist(playlist, usableSources, context, pendingCopies);
            }

            awaitCopies(pendingCopies);
            logger.info("Run complete.");
            return finish(context);
        }
    }

    private void processPlaylist(PlaylistConfig playlist, Map<String, PlaylistSource> usableSources,
                                 RunContext context, List<CompletableFuture<CopyOutcome>> pendingCopies) {
        String playlistId = playlist.playlistId();
        PlaylistSource source = usableSources.get(playlist.account());
        if (source == null) {
            logger.error("No valid client for account '{}'; skipping playlist {}", playlist.account(), playlistId);
            context.recordFailure(playlistId + " (auth)");
            return;
        }

        List<PlaylistItem> items;
        try {
            items = source.listItems(playlistId);
        } catch (AuthFailureException e) {
            logger.error("Auth failed for account {} while fetching playlist {}: {}",
                    playlist.account(), playlistId, e.getMessage());
            context.recordFailure(playlistId + " (auth)");
            usableSources.remove(playlist.account());
            return;
        } catch (PlaylistSourceException e) {
            logger.error("Playlist fetch failed for {}", playlistId, e);
            context.recordFailure(playlistId + " (fetch)");
            return;
        }
        logger.info("Playlist {}: {} entries", playlistId, items.size());

        for (PlaylistItem item : items) {
            boolean accountStillUsable;
            try {
                accountStillUsable = processItem(playlist, item, source, context, pendingCopies);
            } catch (RuntimeException e) {
                logger.error("[{}] Unexpected failure; moving on", item.videoId(), e);
                context.recordFailure(item.videoId());
                FileTrees.deleteQuietly(paths.scratchDirFor(item.videoId()));
                continue;
            }
            if (!accountStillUsable) {
                usableSources.remove(playlist.account());
                return;
            }
        }
    }

    /**
     * @return false if the account's credentials were rejected mid-playlist
     */
    private boolean processItem(PlaylistConfig playlist, PlaylistItem item, PlaylistSource source,
                                RunContext context, List<CompletableFuture<CopyOutcome>> pendingCopies) {
        String videoId = item.videoId();
        if (videoId == null || videoId.isBlank()) {
            return true;
        }

        if (context.isDispatched(videoId)) {
            logger.info("[{}] Already archived earlier in this run; skipping", videoId);
            return true;
        }

        try {
            if (ledger.contains(videoId)) {
                logger.debug("[{}] Already archived; skipping", videoId);
                return true;
            }
        } catch (SQLException e) {
            logger.error("[{}] Ledger lookup failed; skipping", videoId, e);
            return true;
        }

        Optional<VideoMetadata> fetched;
        try {
            fetched = source.getMetadata(videoId);
        } catch (AuthFailureException e) {
            logger.error("Auth failed for account {} while fetching video {}: {}",
                    playlist.account(), videoId, e.getMessage());
            context.recordFailure(videoId + " (auth)");
            return false;
        } catch (PlaylistSourceException e) {
            logger.error("[{}] Metadata fetch failed", videoId, e);
            return true;
        }
        if (fetched.isEmpty()) {
            logger.warn("[{}] Skipping: no metadata", videoId);
            return true;
        }

        VideoMetadata meta = fetched.get();
        String displayName = FileNames.displayName(meta);
        String url = meta.url() != null && !meta.url().isBlank() ? meta.url() : VideoMetadata.watchUrl(videoId);
        Path scratchDir = paths.scratchDirFor(videoId);
        logger.info("START download: {} ({})", videoId, meta.title());

        Path localFile;
        try {
            localFile = engine.download(videoId, url, scratchDir);
        } catch (ExtractionFailedException e) {
            logger.warn("Download FAILED: {}", videoId);
            context.recordFailure(displayName);
            FileTrees.deleteQuietly(scratchDir);
            return true;
        }

        embedder.embed(localFile, videoId, meta);
        if (config.finalFormat() != null) {
            localFile = converter.convert(localFile, config.finalFormat(), videoId);
        }

        String fileName = FileNames.finalFileName(config.filenameTemplate(), meta, videoId, extensionOf(localFile));
        Path destination = Path.of(playlist.folder()).resolve(fileName);

        context.markDispatched(videoId);
        pendingCopies.add(copyWorker.dispatch(new CopyJob(
                videoId,
                playlist.playlistId(),
                item.entryId(),
                displayName,
                localFile,
                destination,
                scratchDir,
                playlist.removeAfterDownload(),
                source), context));
        logger.info("[{}] COPY started in background -> next download begins", videoId);
        return true;
    }

    private void awaitCopies(List<CompletableFuture<CopyOutcome>> pendingCopies) {
        if (pendingCopies.isEmpty()) {
            return;
        }
        logger.info("Waiting for {} copy worker(s) to finish", pendingCopies.size());
        try {
            CompletableFuture.allOf(pendingCopies.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            logger.error("A copy worker ended unexpectedly", e);
        }
    }

    private RunSummary finish(RunContext context) {
        RunSummary summary = context.summarize();
        logSummary(summary);
        if (summary.hasResults()) {
            try {
                notifier.notify(summary.notificationMessage());
            } catch (RuntimeException e) {
                logger.error("Notification failed", e);
            }
        }
        return summary;
    }

    private void logSummary(RunSummary summary) {
        logger.info("=== Run Summary ===");
        logger.info("Total duration: {}ms", summary.totalDurationMs());
        logger.info("Archived: {}, failed: {}", summary.successCount(), summary.failureCount());
        summary.failed().forEach(name -> logger.warn("  FAILED: {}", name));
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
