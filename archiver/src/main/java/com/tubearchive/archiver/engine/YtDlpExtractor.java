package com.tubearchive.archiver.engine;

import com.tubearchive.archiver.process.CommandResult;
import com.tubearchive.archiver.process.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link MediaExtractor} that shells out to the yt-dlp executable. The final
 * output path is printed by yt-dlp itself after post-processing so the
 * engine does not have to guess it from a directory listing.
 */
public class YtDlpExtractor implements MediaExtractor {

    private static final Logger logger = LoggerFactory.getLogger(YtDlpExtractor.class);

    static final String OUTPUT_TEMPLATE = "%(id)s.%(ext)s";
    static final int SOCKET_TIMEOUT_SECONDS = 120;
    static final int NETWORK_RETRIES = 5;

    private final CommandRunner runner;
    private final String executable;
    private final Path tempDir;
    private final String jsRuntime;
    private final Map<String, Object> extraOptions;
    private final Duration attemptTimeout;

    public YtDlpExtractor(CommandRunner runner, String executable, Path tempDir, String jsRuntime,
                          Map<String, Object> extraOptions, Duration attemptTimeout) {
        this.runner = runner;
        this.executable = executable;
        this.tempDir = tempDir;
        this.jsRuntime = jsRuntime;
        this.extraOptions = extraOptions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(extraOptions))
                : Map.of();
        this.attemptTimeout = attemptTimeout;
    }

    @Override
    public Optional<ExtractorOutput> extract(String url, ExtractionRequest request) throws ExtractionException {
        List<String> command = buildCommand(url, request);
        CommandResult result;
        try {
            result = runner.run(command, attemptTimeout);
        } catch (IOException e) {
            throw new ExtractionException("yt-dlp could not be started. Is it installed and on PATH?", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while waiting for yt-dlp", e);
        }

        if (result.timedOut()) {
            throw new ExtractionException("yt-dlp timed out after " + attemptTimeout.toMinutes() + " minutes");
        }
        if (result.exitCode() != 0) {
            throw new ExtractionException("yt-dlp exited with code " + result.exitCode()
                    + (result.lastLine() != null ? ": " + result.lastLine() : ""));
        }
        if (result.output().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ExtractorOutput(parseReportedPath(result.lastLine())));
    }

    List<String> buildCommand(String url, ExtractionRequest request) {
        AttemptStep step = request.step();
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--no-playlist");
        command.add("--print");
        command.add("after_move:filepath");
        command.add("-o");
        command.add(request.scratchDir().resolve(OUTPUT_TEMPLATE).toString());
        command.add("--paths");
        command.add("temp:" + tempDir);
        if (step.formatSelector() != null) {
            command.add("-f");
            command.add(step.formatSelector());
        }
        command.add("--no-continue");
        command.add("--socket-timeout");
        command.add(String.valueOf(SOCKET_TIMEOUT_SECONDS));
        command.add("--retries");
        command.add(String.valueOf(NETWORK_RETRIES));
        command.add("--force-ipv4");
        command.add("--remote-components");
        command.add("ejs:github");

        ExtractionProfile profile = step.profile();
        if (profile != null) {
            for (Map.Entry<String, String> header : profile.headers().entrySet()) {
                command.add("--add-header");
                command.add(header.getKey() + ":" + header.getValue());
            }
            command.add("--extractor-args");
            command.add("youtube:player_client=" + profile.playerClient());
        }

        if (jsRuntime != null && !jsRuntime.isBlank()) {
            command.add("--js-runtimes");
            command.add(jsRuntime);
        }

        appendExtraOptions(command);
        command.add(url);
        return command;
    }

    /**
     * Config overrides use yt-dlp's long option names with or without the
     * leading dashes; underscores are accepted in place of hyphens. A boolean
     * true adds a bare flag, false or null drops the option.
     */
    private void appendExtraOptions(List<String> command) {
        for (Map.Entry<String, Object> option : extraOptions.entrySet()) {
            String name = option.getKey().replaceFirst("^-+", "").replace('_', '-');
            Object value = option.getValue();
            if (value == null || Boolean.FALSE.equals(value)) {
                continue;
            }
            command.add("--" + name);
            if (!Boolean.TRUE.equals(value)) {
                command.add(String.valueOf(value));
            }
        }
    }

    static Path parseReportedPath(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }
        try {
            return Path.of(line.trim());
        } catch (InvalidPathException e) {
            logger.debug("Ignoring unparseable yt-dlp output line: {}", line);
            return null;
        }
    }
}
