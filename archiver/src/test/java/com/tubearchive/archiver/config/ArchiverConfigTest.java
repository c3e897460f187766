package com.tubearchive.archiver.config;

import com.tubearchive.archiver.engine.StrictnessMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArchiverConfigTest {

    @TempDir
    Path dir;

    private Path write(String json) throws IOException {
        return Files.writeString(dir.resolve("config.json"), json);
    }

    // =========================================================================
    // Loading
    // =========================================================================

    @Test
    @DisplayName("Loads every option from JSON")
    void loadsAllOptions() throws IOException {
        Path file = write("""
                {
                  "accounts": { "family": { "token": "tokens/token_family.json" } },
                  "playlists": [
                    { "playlist_id": "PL123", "folder": "/media/videos", "account": "family",
                      "remove_after_download": true }
                  ],
                  "final_format": "MKV",
                  "filename_template": "%(title)s.%(ext)s",
                  "yt_dlp_opts": { "limit-rate": "4M", "embed_subs": true },
                  "js_runtime": "node:/usr/bin/node",
                  "format_strictness": "relaxed",
                  "max_passes": 2,
                  "retries_per_profile": 3,
                  "attempt_timeout_minutes": 10,
                  "telegram": { "bot_token": "123:abc", "chat_id": "42" },
                  "unknown_option": "ignored"
                }
                """);

        ArchiverConfig config = ArchiverConfig.load(file).validate();

        assertEquals("tokens/token_family.json", config.accounts().get("family").token());
        PlaylistConfig playlist = config.playlists().get(0);
        assertEquals("PL123", playlist.playlistId());
        assertEquals("/media/videos", playlist.folder());
        assertTrue(playlist.removeAfterDownload());
        assertEquals("mkv", config.finalFormat());
        assertEquals("%(title)s.%(ext)s", config.filenameTemplate());
        assertEquals("4M", config.ytDlpOpts().get("limit-rate"));
        assertEquals(Boolean.TRUE, config.ytDlpOpts().get("embed_subs"));
        assertEquals("node:/usr/bin/node", config.jsRuntime());
        assertEquals(StrictnessMode.RELAXED, config.strictnessMode());
        assertEquals(2, config.maxPasses().intValue());
        assertEquals(3, config.retriesPerProfile().intValue());
        assertEquals(10, config.attemptTimeoutMinutes().intValue());
        assertTrue(config.telegram().isComplete());
    }

    @Test
    @DisplayName("Absent options take their defaults")
    void defaults() throws IOException {
        ArchiverConfig config = ArchiverConfig.load(write("{}")).validate();

        assertTrue(config.accounts().isEmpty());
        assertTrue(config.playlists().isEmpty());
        assertNull(config.finalFormat());
        assertNull(config.filenameTemplate());
        assertTrue(config.ytDlpOpts().isEmpty());
        assertEquals(StrictnessMode.STRICT, config.strictnessMode());
        assertEquals(4, config.maxPasses().intValue());
        assertEquals(2, config.retriesPerProfile().intValue());
        assertEquals(30, config.attemptTimeoutMinutes().intValue());
        assertNull(config.telegram());
    }

    @Test
    @DisplayName("Missing file is an IOException")
    void missingFile() {
        assertThrows(IOException.class, () -> ArchiverConfig.load(dir.resolve("absent.json")));
    }

    // =========================================================================
    // Validation
    // =========================================================================

    @Test
    @DisplayName("Validation lists every problem at once")
    void validationCollectsProblems() {
        ArchiverConfig config = new ArchiverConfig(
                Map.of(),
                List.of(new PlaylistConfig("", "/media", "ghost", false)),
                "avi", null, null, "deno", "fussy", 0, 0, 0, null);

        IllegalStateException ex = assertThrows(IllegalStateException.class, config::validate);

        String msg = ex.getMessage();
        assertTrue(msg.startsWith("Invalid run configuration"));
        assertTrue(msg.contains("playlist_id"));
        assertTrue(msg.contains("'ghost' is not defined"));
        assertTrue(msg.contains("final_format"));
        assertTrue(msg.contains("format_strictness"));
        assertTrue(msg.contains("max_passes"));
        assertTrue(msg.contains("retries_per_profile"));
        assertTrue(msg.contains("attempt_timeout_minutes"));
        assertTrue(msg.contains("js_runtime"));
    }

    @Test
    @DisplayName("Incomplete Telegram settings are not usable")
    void telegramIncomplete() {
        assertFalse(new TelegramConfig("123:abc", "").isComplete());
        assertFalse(new TelegramConfig(null, "42").isComplete());
    }
}
