package com.tubearchive.archiver.process;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external program to completion. Implementations must never report
 * success without checking the exit status.
 */
public interface CommandRunner {

    /**
     * @throws IOException if the program cannot be started
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
