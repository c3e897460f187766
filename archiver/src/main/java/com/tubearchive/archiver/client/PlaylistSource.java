package com.tubearchive.archiver.client;

import com.tubearchive.archiver.model.PlaylistItem;
import com.tubearchive.archiver.model.VideoMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Where the list of videos to archive comes from.
 */
public interface PlaylistSource {

    List<PlaylistItem> listItems(String playlistId) throws PlaylistSourceException;

    /**
     * @return empty when the source has no such video (deleted, private)
     */
    Optional<VideoMetadata> getMetadata(String videoId) throws PlaylistSourceException;

    void removeItem(String entryId) throws PlaylistSourceException;
}
