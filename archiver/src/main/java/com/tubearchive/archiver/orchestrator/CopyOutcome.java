package com.tubearchive.archiver.orchestrator;

import java.nio.file.Path;

public record CopyOutcome(
        String videoId,
        boolean success,
        Path destination,
        String errorMessage
) {

    public static CopyOutcome success(String videoId, Path destination) {
        return new CopyOutcome(videoId, true, destination, null);
    }

    public static CopyOutcome failure(String videoId, Path destination, String error) {
        return new CopyOutcome(videoId, false, destination, error);
    }
}
