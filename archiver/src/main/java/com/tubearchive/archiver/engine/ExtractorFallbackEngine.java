package com.tubearchive.archiver.engine;

import com.tubearchive.archiver.util.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Drives the extraction layer through the attempt plan until one attempt
 * yields a finished file. Attempts are bounded by passes x plan steps x
 * retries per step; the first attempt that produces a file wins.
 *
 * <p>The scratch directory is wiped before every attempt. A frozen or tiny
 * partial is evidence of an active block, so nothing is ever resumed.</p>
 */
public class ExtractorFallbackEngine {

    private static final Logger logger = LoggerFactory.getLogger(ExtractorFallbackEngine.class);

    public static final int DEFAULT_MAX_PASSES = 4;
    public static final int DEFAULT_RETRIES_PER_PROFILE = 2;

    /** Higher-fidelity container first, the more compatible one as fallback. */
    static final List<String> PREFERRED_EXTENSIONS = List.of(".webm", ".mp4");

    private final MediaExtractor extractor;
    private final PartialFileMonitor partialFileMonitor;
    private final StrictnessMode strictnessMode;
    private final int maxPasses;
    private final int retriesPerProfile;

    public ExtractorFallbackEngine(MediaExtractor extractor, PartialFileMonitor partialFileMonitor,
                                   StrictnessMode strictnessMode, int maxPasses, int retriesPerProfile) {
        this.extractor = extractor;
        this.partialFileMonitor = partialFileMonitor;
        this.strictnessMode = strictnessMode;
        this.maxPasses = maxPasses;
        this.retriesPerProfile = retriesPerProfile;
    }

    /**
     * Downloads one video into {@code scratchDir}.
     *
     * @return the finished media file inside {@code scratchDir}
     * @throws ExtractionFailedException when the whole plan is exhausted
     */
    public Path download(String videoId, String url, Path scratchDir) throws ExtractionFailedException {
        AttemptPlan plan = AttemptPlan.build(strictnessMode);
        int attempts = 0;

        for (int pass = 1; pass <= maxPasses; pass++) {
            logger.info("[{}] Download pass {}/{}", videoId, pass, maxPasses);

            for (AttemptStep step : plan.steps()) {
                logger.info("[{}] Trying extractor: {}", videoId, step.label());

                for (int retry = 1; retry <= retriesPerProfile; retry++) {
                    attempts++;
                    Optional<Path> finished = attempt(videoId, url, scratchDir, step);
                    if (finished.isPresent()) {
                        logger.info("[{}] SUCCESS via {} -> {}", videoId, step.label(),
                                finished.get().getFileName());
                        return finished.get();
                    }
                }
            }

            logger.warn("[{}] All extractors failed on pass {}", videoId, pass);
        }

        logger.error("[{}] PERMANENT FAILURE after {} passes ({} attempts)", videoId, maxPasses, attempts);
        throw new ExtractionFailedException(videoId, attempts);
    }

    private Optional<Path> attempt(String videoId, String url, Path scratchDir, AttemptStep step) {
        if (partialFileMonitor.isStalled(scratchDir, videoId)) {
            logger.warn("[{}] Stuck partial detected, wiping scratch directory", videoId);
        }
        try {
            FileTrees.recreate(scratchDir);
        } catch (IOException e) {
            logger.warn("[{}] Could not reset scratch directory {}: {}", videoId, scratchDir, e.getMessage());
            return Optional.empty();
        }

        Optional<ExtractorOutput> output;
        try {
            output = extractor.extract(url, new ExtractionRequest(videoId, scratchDir, step));
        } catch (ExtractionException e) {
            logger.warn("[{}] {} failed: {}", videoId, step.label(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.warn("[{}] {} failed unexpectedly", videoId, step.label(), e);
            return Optional.empty();
        }

        if (output.isEmpty()) {
            logger.warn("[{}] No info returned from extractor {}", videoId, step.label());
            return Optional.empty();
        }

        Optional<Path> chosen = resolveOutput(videoId, scratchDir, output.get().reportedFile());
        if (chosen.isEmpty()) {
            logger.warn("[{}] Extractor {} produced no usable output", videoId, step.label());
        }
        return chosen;
    }

    /**
     * Prefers the path the extractor reported. Falls back to scanning the
     * scratch directory for a file named after the video, by extension
     * preference.
     */
    static Optional<Path> resolveOutput(String videoId, Path scratchDir, Path reported) {
        Path root = scratchDir.toAbsolutePath().normalize();
        if (reported != null) {
            Path candidate = reported.toAbsolutePath().normalize();
            if (candidate.startsWith(root)
                    && candidate.getFileName().toString().startsWith(videoId)
                    && Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(root)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith(videoId))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            return Optional.empty();
        }

        for (String extension : PREFERRED_EXTENSIONS) {
            for (Path file : files) {
                if (file.getFileName().toString().endsWith(extension)) {
                    return Optional.of(file);
                }
            }
        }
        return Optional.empty();
    }
}
