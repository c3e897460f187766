package com.tubearchive.archiver.orchestrator;

import com.tubearchive.archiver.client.PlaylistSource;

import java.nio.file.Path;

/**
 * Everything the background copy and its completion need for one video.
 *
 * @param entryId        playlist entry handle for removal, may be null
 * @param source         finished local file to copy
 * @param destination    final path in the playlist folder
 * @param scratchDir     per-video scratch directory, deleted once the copy completes
 * @param playlistSource playlist source to remove the entry from, may be null
 */
public record CopyJob(
        String videoId,
        String playlistId,
        String entryId,
        String displayName,
        Path source,
        Path destination,
        Path scratchDir,
        boolean removeAfterDownload,
        PlaylistSource playlistSource
) {
}
