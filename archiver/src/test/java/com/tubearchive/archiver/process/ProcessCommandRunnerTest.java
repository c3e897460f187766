package com.tubearchive.archiver.process;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ProcessCommandRunnerTest {

    private static final String SH = "/bin/sh";

    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @BeforeEach
    void requireShell() {
        assumeTrue(Files.isExecutable(Path.of(SH)), "needs a POSIX shell");
    }

    @Test
    @DisplayName("Captures combined output and the exit code")
    void capturesOutput() throws Exception {
        CommandResult result = runner.run(List.of(SH, "-c", "echo out; echo err 1>&2; exit 3"),
                Duration.ofSeconds(30));

        assertEquals(3, result.exitCode());
        assertFalse(result.timedOut());
        assertFalse(result.success());
        assertTrue(result.output().contains("out"));
        assertTrue(result.output().contains("err"));
    }

    @Test
    @DisplayName("lastLine is the last non-blank line")
    void lastLine() throws Exception {
        CommandResult result = runner.run(List.of(SH, "-c", "echo first; echo /tmp/x/abc.webm; echo"),
                Duration.ofSeconds(30));

        assertTrue(result.success());
        assertEquals("/tmp/x/abc.webm", result.lastLine());
    }

    @Test
    @DisplayName("Output is trimmed to the most recent lines")
    void outputBounded() throws Exception {
        CommandResult result = runner.run(List.of(SH, "-c", "i=0; while [ $i -lt 500 ]; do echo $i; i=$((i+1)); done"),
                Duration.ofSeconds(30));

        assertEquals(ProcessCommandRunner.MAX_OUTPUT_LINES, result.output().size());
        assertEquals("499", result.lastLine());
    }

    @Test
    @DisplayName("Overrunning processes are killed and reported as timed out")
    void timeout() throws Exception {
        CommandResult result = runner.run(List.of(SH, "-c", "sleep 30"), Duration.ofMillis(300));

        assertTrue(result.timedOut());
        assertEquals(-1, result.exitCode());
    }

    @Test
    @DisplayName("Missing executable is an IOException")
    void missingExecutable() {
        assertThrows(IOException.class,
                () -> runner.run(List.of("/nonexistent/yt-dlp-binary"), Duration.ofSeconds(5)));
    }
}
