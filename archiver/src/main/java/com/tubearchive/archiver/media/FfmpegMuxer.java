package com.tubearchive.archiver.media;

import com.tubearchive.archiver.process.CommandResult;
import com.tubearchive.archiver.process.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link MediaMuxer} running {@code ffmpeg -c copy}.
 */
public class FfmpegMuxer implements MediaMuxer {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegMuxer.class);

    static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(10);

    private final CommandRunner runner;
    private final String executable;
    private final Duration timeout;

    public FfmpegMuxer(CommandRunner runner, String executable) {
        this(runner, executable, DEFAULT_TIMEOUT);
    }

    public FfmpegMuxer(CommandRunner runner, String executable, Duration timeout) {
        this.runner = runner;
        this.executable = executable;
        this.timeout = timeout;
    }

    @Override
    public void mux(MuxRequest request) throws MuxException {
        List<String> command = buildCommand(request);
        CommandResult result;
        try {
            result = runner.run(command, timeout);
        } catch (IOException e) {
            throw new MuxException("ffmpeg could not be started. Is it installed and on PATH?", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MuxException("Interrupted while waiting for ffmpeg", e);
        }

        if (result.timedOut()) {
            throw new MuxException("ffmpeg timed out after " + timeout.toSeconds() + "s on " + request.input());
        }
        if (result.exitCode() != 0) {
            logger.debug("ffmpeg output for {}: {}", request.input(), result.output());
            throw new MuxException("ffmpeg exited with code " + result.exitCode()
                    + (result.lastLine() != null ? ": " + result.lastLine() : ""));
        }
    }

    List<String> buildCommand(MuxRequest request) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("-y");
        command.add("-i");
        command.add(request.input().toString());

        MuxRequest.Attachment attachment = request.attachment();
        if (attachment != null) {
            command.add("-attach");
            command.add(attachment.file().toString());
            command.add("-metadata:s:t");
            command.add("mimetype=" + attachment.mimeType());
            command.add("-metadata:s:t");
            command.add("filename=" + attachment.filename());
        }

        for (Map.Entry<String, String> tag : request.metadata().entrySet()) {
            command.add("-metadata");
            command.add(tag.getKey() + "=" + tag.getValue());
        }

        if (request.copyAllStreams()) {
            command.add("-map");
            command.add("0");
        }
        command.add("-c");
        command.add("copy");
        command.add(request.output().toString());
        return command;
    }
}
