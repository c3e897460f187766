package com.tubearchive.archiver.engine;

import java.nio.file.Path;

/**
 * A single extraction attempt: which video, where the output goes, and which
 * plan step (format selector plus optional profile) to use.
 */
public record ExtractionRequest(
        String videoId,
        Path scratchDir,
        AttemptStep step
) {
}
