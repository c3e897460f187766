package com.tubearchive.archiver.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileTreesTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("deleteRecursively removes nested content and tolerates a missing root")
    void deleteRecursively() throws IOException {
        Path root = dir.resolve("scratch");
        Files.createDirectories(root.resolve("a/b"));
        Files.writeString(root.resolve("a/b/file.part"), "x");

        FileTrees.deleteRecursively(root);

        assertFalse(Files.exists(root));
        assertDoesNotThrow(() -> FileTrees.deleteRecursively(root));
    }

    @Test
    @DisplayName("recreate leaves an empty directory")
    void recreate() throws IOException {
        Path root = dir.resolve("scratch");
        Files.createDirectories(root);
        Files.writeString(root.resolve("old.webm"), "x");

        FileTrees.recreate(root);

        assertTrue(Files.isDirectory(root));
        try (Stream<Path> files = Files.list(root)) {
            assertEquals(0, files.count());
        }
    }
}
