package com.tubearchive.archiver.model;

/**
 * One entry of a playlist listing. The entry id is the handle used to remove
 * the video from the playlist and may be null.
 */
public record PlaylistItem(
        String videoId,
        String playlistId,
        String entryId
) {
}
