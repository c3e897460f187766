package com.tubearchive.archiver.media;

import com.tubearchive.archiver.model.VideoMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes title, channel, date, description, tags, source comment and a cover
 * image into a finished media file without re-encoding it. The tagged copy is
 * built next to the original and swapped in only after the muxer succeeds,
 * so a failed run leaves the original byte-for-byte intact.
 */
public class MetadataEmbedder {

    private static final Logger logger = LoggerFactory.getLogger(MetadataEmbedder.class);

    static final String COVER_MIME_TYPE = "image/jpeg";
    static final String COVER_FILENAME = "cover.jpg";

    /** Containers that can carry a file attachment. */
    static final Set<String> ATTACHMENT_CONTAINERS = Set.of("mkv", "webm", "mka");

    private final MediaMuxer muxer;
    private final ThumbnailFetcher thumbnailFetcher;
    private final Path thumbsDir;

    public MetadataEmbedder(MediaMuxer muxer, ThumbnailFetcher thumbnailFetcher, Path thumbsDir) {
        this.muxer = muxer;
        this.thumbnailFetcher = thumbnailFetcher;
        this.thumbsDir = thumbsDir;
    }

    /**
     * Tags {@code mediaFile} in place.
     *
     * @return true if the tagged file replaced the original
     */
    public boolean embed(Path mediaFile, String videoId, VideoMetadata meta) {
        if (meta == null) {
            return false;
        }

        String extension = extensionOf(mediaFile);
        Path thumbTarget = thumbsDir.resolve(videoId + ".jpg");
        Path tagged = null;
        try {
            Optional<Path> thumbnail = thumbnailFetcher.fetch(meta.thumbnailUrl(), thumbTarget);

            MuxRequest.Attachment cover = null;
            if (thumbnail.isPresent()) {
                if (ATTACHMENT_CONTAINERS.contains(extension)) {
                    cover = new MuxRequest.Attachment(thumbnail.get(), COVER_MIME_TYPE, COVER_FILENAME);
                } else {
                    logger.info("[{}] .{} cannot carry attachments; skipping cover", videoId, extension);
                }
            }

            tagged = Files.createTempFile(mediaFile.getParent(), videoId + ".",
                    ".tagged." + (extension.isEmpty() ? "webm" : extension));
            muxer.mux(new MuxRequest(mediaFile, buildTags(videoId, meta), cover, tagged, true));

            replace(tagged, mediaFile);
            tagged = null;
            logger.info("[{}] Metadata embedded successfully", videoId);
            return true;
        } catch (MuxException e) {
            logger.error("[{}] ffmpeg metadata embedding failed: {}", videoId, e.getMessage());
            return false;
        } catch (IOException | RuntimeException e) {
            logger.error("[{}] Unexpected error during metadata embedding", videoId, e);
            return false;
        } finally {
            if (tagged != null) {
                deleteIfExists(tagged, videoId);
            }
            deleteIfExists(thumbTarget, videoId);
        }
    }

    static Map<String, String> buildTags(String videoId, VideoMetadata meta) {
        Map<String, String> tags = new LinkedHashMap<>();
        String title = meta.title().isBlank() ? videoId : meta.title();
        String url = meta.url() != null && !meta.url().isBlank() ? meta.url() : VideoMetadata.watchUrl(videoId);

        tags.put("title", title);
        if (!meta.channel().isBlank()) {
            tags.put("artist", meta.channel());
        }
        normalizeDate(meta.uploadDate()).ifPresent(date -> tags.put("date", date));
        if (!meta.description().isBlank()) {
            tags.put("description", meta.description());
        }
        if (!meta.tags().isEmpty()) {
            tags.put("keywords", String.join(", ", meta.tags()));
        }
        tags.put("comment", "YouTubeID=" + videoId + " URL=" + url);
        return tags;
    }

    /**
     * {@code YYYYMMDD} to {@code YYYY-MM-DD}; anything else has no date.
     */
    public static Optional<String> normalizeDate(String uploadDate) {
        if (!VideoMetadata.isCompactDate(uploadDate)) {
            return Optional.empty();
        }
        return Optional.of(uploadDate.substring(0, 4) + "-" + uploadDate.substring(4, 6)
                + "-" + uploadDate.substring(6, 8));
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteIfExists(Path path, String videoId) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("[{}] Could not delete {}: {}", videoId, path, e.getMessage());
        }
    }
}
