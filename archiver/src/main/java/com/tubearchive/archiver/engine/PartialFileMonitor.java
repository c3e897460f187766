package com.tubearchive.archiver.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Detects in-progress downloads that look blocked rather than slow. A real
 * transfer passes the size floor within seconds; a {@code .part} file still
 * below it is treated as a block and must not be resumed.
 */
public class PartialFileMonitor {

    private static final Logger logger = LoggerFactory.getLogger(PartialFileMonitor.class);

    public static final String PART_SUFFIX = ".part";
    public static final long DEFAULT_STALL_THRESHOLD_BYTES = 512L * 1024;

    private final long stallThresholdBytes;

    public PartialFileMonitor() {
        this(DEFAULT_STALL_THRESHOLD_BYTES);
    }

    public PartialFileMonitor(long stallThresholdBytes) {
        this.stallThresholdBytes = stallThresholdBytes;
    }

    /**
     * @return true if {@code scratchDir} holds a {@code .part} file for the
     *         video that is under the threshold or cannot be inspected
     */
    public boolean isStalled(Path scratchDir, String videoId) {
        if (!Files.isDirectory(scratchDir)) {
            return false;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(scratchDir)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (!name.startsWith(videoId) || !name.endsWith(PART_SUFFIX)) {
                    continue;
                }
                try {
                    long size = Files.size(entry);
                    if (size < stallThresholdBytes) {
                        logger.debug("[{}] Partial {} is {} bytes, below {}", videoId, name, size,
                                stallThresholdBytes);
                        return true;
                    }
                } catch (IOException e) {
                    logger.debug("[{}] Cannot read size of {}: {}", videoId, name, e.getMessage());
                    return true;
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            logger.debug("[{}] Cannot list {}: {}", videoId, scratchDir, e.getMessage());
            return true;
        }
        return false;
    }
}
