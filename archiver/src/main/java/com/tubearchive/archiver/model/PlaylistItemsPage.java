package com.tubearchive.archiver.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Data transfer object for one page of the YouTube Data API response:
 * GET /playlistItems?part=snippet,contentDetails
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaylistItemsPage(
        @JsonProperty("items") List<Entry> items,
        @JsonProperty("nextPageToken") String nextPageToken
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
            @JsonProperty("id") String id,
            @JsonProperty("contentDetails") ContentDetails contentDetails
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ContentDetails(
            @JsonProperty("videoId") String videoId
    ) {}
}
