package com.tubearchive.archiver.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One subscribed playlist: where it comes from, which account reads it, where
 * finished files go, and whether entries are removed once archived.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaylistConfig(
        @JsonProperty("playlist_id") String playlistId,
        @JsonProperty("folder") String folder,
        @JsonProperty("account") String account,
        @JsonProperty("remove_after_download") boolean removeAfterDownload
) {
}
