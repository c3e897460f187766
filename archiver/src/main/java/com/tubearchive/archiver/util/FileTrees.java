package com.tubearchive.archiver.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Recursive delete helpers for scratch directories.
 */
public final class FileTrees {

    private static final Logger logger = LoggerFactory.getLogger(FileTrees.class);

    private FileTrees() {
    }

    /**
     * Deletes {@code root} and everything below it. A missing root is not an error.
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }

    /**
     * Same as {@link #deleteRecursively(Path)} but only logs failures.
     */
    public static void deleteQuietly(Path root) {
        try {
            deleteRecursively(root);
        } catch (IOException e) {
            logger.warn("Could not delete {}: {}", root, e.getMessage());
        }
    }

    /**
     * Deletes {@code dir} if present and creates it again, empty.
     */
    public static void recreate(Path dir) throws IOException {
        deleteRecursively(dir);
        Files.createDirectories(dir);
    }
}
