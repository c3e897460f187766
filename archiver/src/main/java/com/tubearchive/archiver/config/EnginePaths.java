package com.tubearchive.archiver.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Directory layout under the data directory. Scratch directories are
 * per-video subdirectories of {@code tempDownloadsDir}.
 */
public record EnginePaths(
        Path dataDir,
        Path dbPath,
        Path tempDownloadsDir,
        Path lockFile,
        Path ytdlpTempDir,
        Path thumbsDir
) {

    public static EnginePaths under(Path dataDir) {
        Path root = dataDir.toAbsolutePath().normalize();
        Path ytdlpTemp = root.resolve("tmp").resolve("yt-dlp");
        return new EnginePaths(
                root,
                root.resolve("database").resolve("db.sqlite"),
                root.resolve("temp_downloads"),
                root.resolve("tmp").resolve("tubearchive.lock"),
                ytdlpTemp,
                ytdlpTemp.resolve("thumbs"));
    }

    public Path scratchDirFor(String videoId) {
        return tempDownloadsDir.resolve(videoId);
    }

    public void createDirectories() throws IOException {
        for (Path dir : new Path[]{dbPath.getParent(), tempDownloadsDir, lockFile.getParent(),
                ytdlpTempDir, thumbsDir}) {
            Files.createDirectories(dir);
        }
    }
}
