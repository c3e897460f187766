package com.tubearchive.archiver.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class JsRuntimesTest {

    @TempDir
    Path dir;

    private Path executable(Path parent, String name) throws IOException {
        Files.createDirectories(parent);
        Path file = Files.writeString(parent.resolve(name), "#!/bin/sh\n");
        assumeTrue(file.toFile().setExecutable(true), "cannot mark files executable here");
        return file;
    }

    @Test
    @DisplayName("Configured value wins over environment and PATH")
    void configuredWins() throws IOException {
        Path bin = dir.resolve("bin");
        executable(bin, "deno");

        assertEquals("node:/opt/node", JsRuntimes.resolve("node:/opt/node", "deno:/env/deno", bin.toString()));
    }

    @Test
    @DisplayName("Environment value wins over PATH")
    void environmentWins() throws IOException {
        Path bin = dir.resolve("bin");
        executable(bin, "deno");

        assertEquals("deno:/env/deno", JsRuntimes.resolve(null, "deno:/env/deno", bin.toString()));
    }

    @Test
    @DisplayName("deno on PATH is preferred over node")
    void denoPreferred() throws IOException {
        Path first = dir.resolve("first");
        Path second = dir.resolve("second");
        executable(first, "node");
        Path deno = executable(second, "deno");

        String resolved = JsRuntimes.resolve(null, null, first + File.pathSeparator + second);

        assertEquals("deno:" + deno, resolved);
    }

    @Test
    @DisplayName("node is used when deno is absent")
    void nodeFallback() throws IOException {
        Path bin = dir.resolve("bin");
        Path node = executable(bin, "node");

        assertEquals("node:" + node, JsRuntimes.resolve(null, " ", bin.toString()));
    }

    @Test
    @DisplayName("No runtime anywhere resolves to null")
    void nothingFound() {
        assertNull(JsRuntimes.resolve(null, null, dir.toString()));
        assertNull(JsRuntimes.resolve(null, null, null));
    }
}
