package com.tubearchive.archiver.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Data transfer object for the YouTube Data API response:
 * GET /videos?part=snippet,contentDetails&id={videoId}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VideoListResponse(
        @JsonProperty("items") List<Video> items
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Video(
            @JsonProperty("id") String id,
            @JsonProperty("snippet") Snippet snippet
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Snippet(
            @JsonProperty("title") String title,
            @JsonProperty("channelTitle") String channelTitle,
            @JsonProperty("publishedAt") Instant publishedAt,
            @JsonProperty("description") String description,
            @JsonProperty("tags") List<String> tags,
            @JsonProperty("thumbnails") Map<String, Thumbnail> thumbnails
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Thumbnail(
            @JsonProperty("url") String url,
            @JsonProperty("width") int width,
            @JsonProperty("height") int height
    ) {}
}
