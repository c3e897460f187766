package com.tubearchive.archiver.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Picks the JavaScript runtime yt-dlp should use for player challenges, as
 * {@code name:path}. Order: run configuration, environment, {@code deno} on
 * PATH, {@code node} on PATH.
 */
public final class JsRuntimes {

    private static final Logger logger = LoggerFactory.getLogger(JsRuntimes.class);

    static final List<String> CANDIDATES = List.of("deno", "node");

    private JsRuntimes() {
    }

    public static String resolve(String configured, String fromEnvironment) {
        return resolve(configured, fromEnvironment, System.getenv("PATH"));
    }

    static String resolve(String configured, String fromEnvironment, String searchPath) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        if (fromEnvironment != null && !fromEnvironment.isBlank()) {
            return fromEnvironment;
        }
        for (String candidate : CANDIDATES) {
            Optional<Path> found = which(candidate, searchPath);
            if (found.isPresent()) {
                logger.info("Using {} at {} as JS runtime", candidate, found.get());
                return candidate + ":" + found.get();
            }
        }
        logger.info("No JS runtime found; yt-dlp will run without one");
        return null;
    }

    static Optional<Path> which(String executable, String searchPath) {
        if (searchPath == null || searchPath.isBlank()) {
            return Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            try {
                Path candidate = Path.of(dir, executable);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return Optional.of(candidate);
                }
            } catch (InvalidPathException e) {
                logger.debug("Skipping invalid PATH entry {}", dir);
            }
        }
        return Optional.empty();
    }
}
