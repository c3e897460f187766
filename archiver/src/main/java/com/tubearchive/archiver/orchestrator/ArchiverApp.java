package com.tubearchive.archiver.orchestrator;

import com.tubearchive.archiver.client.AccessTokens;
import com.tubearchive.archiver.client.AuthFailureException;
import com.tubearchive.archiver.client.PlaylistSource;
import com.tubearchive.archiver.client.YouTubeApiClient;
import com.tubearchive.archiver.config.AccountConfig;
import com.tubearchive.archiver.config.AppConfig;
import com.tubearchive.archiver.config.ArchiverConfig;
import com.tubearchive.archiver.config.EnginePaths;
import com.tubearchive.archiver.config.JsRuntimes;
import com.tubearchive.archiver.engine.ExtractorFallbackEngine;
import com.tubearchive.archiver.engine.PartialFileMonitor;
import com.tubearchive.archiver.engine.YtDlpExtractor;
import com.tubearchive.archiver.ledger.DownloadLedger;
import com.tubearchive.archiver.media.ContainerConverter;
import com.tubearchive.archiver.media.FfmpegMuxer;
import com.tubearchive.archiver.media.MetadataEmbedder;
import com.tubearchive.archiver.media.ThumbnailFetcher;
import com.tubearchive.archiver.notify.Notifier;
import com.tubearchive.archiver.notify.TelegramNotifier;
import com.tubearchive.archiver.process.CommandRunner;
import com.tubearchive.archiver.process.ProcessCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Main entry point for the TubeArchive playlist archiver.
 * Loads configuration, wires the components, runs one archive pass,
 * and exits with an appropriate status code.
 *
 * <p>Usage:
 * <pre>
 *   java -jar archiver.jar                          # config from TUBEARCHIVE_CONFIG or data/config/config.json
 *   java -jar archiver.jar --config /etc/tube.json  # explicit run configuration
 * </pre>
 */
public class ArchiverApp {

    private static final Logger logger = LoggerFactory.getLogger(ArchiverApp.class);

    public static void main(String[] args) {
        logger.info("Starting TubeArchive");

        try {
            AppConfig appConfig = new AppConfig();
            Path configPath = Path.of(parseConfigPath(args, appConfig.getConfigPath()));
            ArchiverConfig config = ArchiverConfig.load(configPath).validate();

            EnginePaths paths = EnginePaths.under(Path.of(appConfig.getDataDir()));
            paths.createDirectories();

            CommandRunner runner = new ProcessCommandRunner();
            String jsRuntime = JsRuntimes.resolve(config.jsRuntime(), appConfig.getJsRuntime());
            YtDlpExtractor extractor = new YtDlpExtractor(runner, appConfig.getYtDlpPath(),
                    paths.ytdlpTempDir(), jsRuntime, config.ytDlpOpts(),
                    Duration.ofMinutes(config.attemptTimeoutMinutes()));
            ExtractorFallbackEngine engine = new ExtractorFallbackEngine(extractor, new PartialFileMonitor(),
                    config.strictnessMode(), config.maxPasses(), config.retriesPerProfile());

            FfmpegMuxer muxer = new FfmpegMuxer(runner, appConfig.getFfmpegPath());
            MetadataEmbedder embedder = new MetadataEmbedder(muxer, new ThumbnailFetcher(), paths.thumbsDir());
            ContainerConverter converter = new ContainerConverter(muxer);

            Map<String, PlaylistSource> sources = buildSources(config.accounts(), YouTubeApiClient::new);
            Notifier notifier = config.telegram() != null && config.telegram().isComplete()
                    ? new TelegramNotifier(config.telegram().botToken(), config.telegram().chatId())
                    : Notifier.none();

            DownloadLedger ledger = new DownloadLedger(paths.dbPath());
            RunSummary summary;
            try (CopyLedgerWorker copyWorker = new CopyLedgerWorker(ledger)) {
                RunCoordinator coordinator = new RunCoordinator(config, paths, sources, ledger, engine,
                        embedder, converter, copyWorker, notifier);
                summary = coordinator.run();
            }

            printSummary(summary);

            if (summary.hasFailures()) {
                logger.warn("Run completed with failures");
                System.exit(1);
            }

            logger.info("TubeArchive finished successfully.");
            System.exit(0);

        } catch (Exception e) {
            logger.error("Fatal error during archive run", e);
            System.exit(1);
        }
    }

    static String parseConfigPath(String[] args, String defaultPath) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a path");
                }
                return args[i + 1];
            }
            if (args[i].startsWith("--config=")) {
                return args[i].substring("--config=".length());
            }
        }
        return defaultPath;
    }

    /**
     * One playlist source per account. Accounts whose token cannot be read are
     * left out; their playlists fail as auth failures during the run.
     */
    static Map<String, PlaylistSource> buildSources(Map<String, AccountConfig> accounts,
                                                    Function<String, PlaylistSource> factory) {
        Map<String, PlaylistSource> sources = new LinkedHashMap<>();
        accounts.forEach((name, account) -> {
            if (account == null || account.token() == null || account.token().isBlank()) {
                logger.error("Account '{}' has no token file configured; skipping", name);
                return;
            }
            try {
                String token = AccessTokens.read(Path.of(account.token()));
                sources.put(name, factory.apply(token));
                logger.info("Loaded client for account '{}'", name);
            } catch (AuthFailureException e) {
                logger.error("Failed loading token for account '{}': {}", name, e.getMessage());
            }
        });
        return sources;
    }

    private static void printSummary(RunSummary summary) {
        System.out.println();
        System.out.println("=== TubeArchive Run Summary ===");
        if (summary.skipped()) {
            System.out.println("Skipped: another run holds the lock.");
            System.out.println();
            return;
        }
        System.out.println("Duration: " + summary.totalDurationMs() + "ms");
        System.out.println("Results:  " + summary.successCount() + " archived, "
                + summary.failureCount() + " failed");

        if (!summary.succeeded().isEmpty()) {
            System.out.println();
            System.out.println("Archived:");
            summary.succeeded().forEach(name -> System.out.println("  - " + name));
        }
        if (summary.hasFailures()) {
            System.out.println();
            System.out.println("Failures:");
            summary.failed().forEach(name -> System.out.println("  - " + name));
        }
        System.out.println();
    }
}
