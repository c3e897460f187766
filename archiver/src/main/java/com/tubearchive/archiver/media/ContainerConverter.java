package com.tubearchive.archiver.media;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Repackages a finished file into the requested container by stream copy.
 * MP4 to WebM is refused: H.264/AAC streams are not valid WebM content and a
 * copy produces a broken file.
 */
public class ContainerConverter {

    private static final Logger logger = LoggerFactory.getLogger(ContainerConverter.class);

    private final MediaMuxer muxer;

    public ContainerConverter(MediaMuxer muxer) {
        this.muxer = muxer;
    }

    /**
     * @return the canonical file after conversion; the input path when nothing
     *         was converted
     */
    public Path convert(Path file, String desiredExtension, String videoId) {
        String desired = normalize(desiredExtension);
        if (desired.isEmpty()) {
            return file;
        }
        String current = MetadataEmbedder.extensionOf(file);
        if (current.equals(desired)) {
            return file;
        }
        if (isRefused(current, desired)) {
            logger.warn("[{}] Skipping {}->{} container copy to avoid an invalid file; consider final_format={}",
                    videoId, current, desired, current);
            return file;
        }

        String name = file.getFileName().toString();
        String base = current.isEmpty() ? name : name.substring(0, name.length() - current.length() - 1);
        Path converted = file.resolveSibling(base + "." + desired);
        try {
            muxer.mux(MuxRequest.remux(file, converted));
        } catch (MuxException e) {
            logger.error("[{}] Final format conversion to {} failed: {}", videoId, desired, e.getMessage());
            deleteQuietly(converted, videoId);
            return file;
        }

        try {
            Files.delete(file);
        } catch (IOException e) {
            logger.warn("[{}] Converted to {} but could not delete {}: {}", videoId, converted.getFileName(),
                    file, e.getMessage());
        }
        logger.info("[{}] Converted {} -> {}", videoId, file.getFileName(), converted.getFileName());
        return converted;
    }

    static boolean isRefused(String currentExtension, String desiredExtension) {
        return "mp4".equals(currentExtension) && "webm".equals(desiredExtension);
    }

    static String normalize(String extension) {
        if (extension == null) {
            return "";
        }
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }

    private static void deleteQuietly(Path path, String videoId) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("[{}] Could not delete partial output {}: {}", videoId, path, e.getMessage());
        }
    }
}
