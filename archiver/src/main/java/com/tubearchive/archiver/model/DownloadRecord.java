package com.tubearchive.archiver.model;

import java.time.Instant;

/**
 * Ledger row written once a video has been copied to its destination.
 */
public record DownloadRecord(
        String videoId,
        String playlistId,
        Instant downloadedAt,
        String filePath
) {
}
