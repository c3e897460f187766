package com.tubearchive.archiver.model;

import java.util.List;

/**
 * Descriptive metadata for a single video, as returned by the playlist source.
 * Upload date is the compact {@code YYYYMMDD} form, or empty when unknown.
 */
public record VideoMetadata(
        String title,
        String channel,
        String uploadDate,
        String description,
        List<String> tags,
        String url,
        String thumbnailUrl
) {

    public VideoMetadata {
        title = title != null ? title : "";
        channel = channel != null ? channel : "";
        uploadDate = uploadDate != null ? uploadDate : "";
        description = description != null ? description : "";
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    /**
     * True for exactly eight ASCII digits.
     */
    public static boolean isCompactDate(String value) {
        return value != null && value.length() == 8 && value.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    public static String watchUrl(String videoId) {
        return "https://www.youtube.com/watch?v=" + videoId;
    }
}
