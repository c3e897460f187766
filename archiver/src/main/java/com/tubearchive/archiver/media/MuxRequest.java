package com.tubearchive.archiver.media;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Arguments for one stream-copy muxing run: explicit input and output, the
 * container-level metadata to set, and an optional file attachment.
 *
 * @param copyAllStreams map every input stream instead of letting the muxer
 *                       pick one per type; used when the container stays the same
 */
public record MuxRequest(
        Path input,
        Map<String, String> metadata,
        Attachment attachment,
        Path output,
        boolean copyAllStreams
) {

    public record Attachment(Path file, String mimeType, String filename) {}

    public MuxRequest {
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    /**
     * Plain container change, no tags.
     */
    public static MuxRequest remux(Path input, Path output) {
        return new MuxRequest(input, Map.of(), null, output, false);
    }
}
