package com.tubearchive.archiver.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Output is drained on
 * a helper thread so a chatty child can never block on a full pipe while the
 * caller waits for the timeout.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(ProcessCommandRunner.class);

    static final int MAX_OUTPUT_LINES = 200;

    @Override
    public CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);

        Process process = pb.start();
        Deque<String> tail = new ArrayDeque<>();
        Thread drainer = new Thread(() -> drain(process, tail), "process-output-" + process.pid());
        drainer.setDaemon(true);
        drainer.start();

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            logger.warn("{} did not finish within {}s; killing it", command.get(0), timeout.toSeconds());
            process.destroyForcibly();
            process.waitFor(10, TimeUnit.SECONDS);
        }
        drainer.join(TimeUnit.SECONDS.toMillis(5));

        List<String> output;
        synchronized (tail) {
            output = new ArrayList<>(tail);
        }
        int exitCode = finished ? process.exitValue() : -1;
        logger.debug("{} exited with {} ({} output lines kept)", command.get(0), exitCode, output.size());
        return new CommandResult(exitCode, output, !finished);
    }

    private static void drain(Process process, Deque<String> tail) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (tail) {
                    tail.addLast(line);
                    if (tail.size() > MAX_OUTPUT_LINES) {
                        tail.removeFirst();
                    }
                }
            }
        } catch (IOException e) {
            logger.debug("Output stream of pid {} closed: {}", process.pid(), e.getMessage());
        }
    }
}
