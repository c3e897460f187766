package com.tubearchive.archiver.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tubearchive.archiver.engine.ExtractorFallbackEngine;
import com.tubearchive.archiver.engine.StrictnessMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The run configuration file. Every recognized option is listed here with its
 * default; {@link #validate()} runs once before a run starts and reports all
 * problems at once.
 *
 * <pre>
 * {
 *   "accounts":  { "family": { "token": "tokens/token_family.json" } },
 *   "playlists": [ { "playlist_id": "PL...", "folder": "/media/videos",
 *                    "account": "family", "remove_after_download": false } ],
 *   "final_format": "mkv",
 *   "filename_template": "%(title)s - %(uploader)s - %(upload_date)s.%(ext)s",
 *   "yt_dlp_opts": { "limit-rate": "4M" },
 *   "js_runtime": "deno:/usr/bin/deno",
 *   "format_strictness": "strict",
 *   "max_passes": 4,
 *   "retries_per_profile": 2,
 *   "attempt_timeout_minutes": 30,
 *   "telegram": { "bot_token": "...", "chat_id": "..." }
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchiverConfig(
        @JsonProperty("accounts") Map<String, AccountConfig> accounts,
        @JsonProperty("playlists") List<PlaylistConfig> playlists,
        @JsonProperty("final_format") String finalFormat,
        @JsonProperty("filename_template") String filenameTemplate,
        @JsonProperty("yt_dlp_opts") Map<String, Object> ytDlpOpts,
        @JsonProperty("js_runtime") String jsRuntime,
        @JsonProperty("format_strictness") String formatStrictness,
        @JsonProperty("max_passes") Integer maxPasses,
        @JsonProperty("retries_per_profile") Integer retriesPerProfile,
        @JsonProperty("attempt_timeout_minutes") Integer attemptTimeoutMinutes,
        @JsonProperty("telegram") TelegramConfig telegram
) {

    private static final Logger logger = LoggerFactory.getLogger(ArchiverConfig.class);

    public static final Set<String> SUPPORTED_FINAL_FORMATS = Set.of("mp4", "mkv", "webm");
    public static final int DEFAULT_ATTEMPT_TIMEOUT_MINUTES = 30;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public ArchiverConfig {
        accounts = accounts != null ? Collections.unmodifiableMap(new LinkedHashMap<>(accounts)) : Map.of();
        playlists = playlists != null ? List.copyOf(playlists) : List.of();
        finalFormat = finalFormat != null && !finalFormat.isBlank()
                ? finalFormat.trim().toLowerCase(Locale.ROOT)
                : null;
        filenameTemplate = filenameTemplate != null && !filenameTemplate.isBlank() ? filenameTemplate : null;
        ytDlpOpts = ytDlpOpts != null ? Collections.unmodifiableMap(new LinkedHashMap<>(ytDlpOpts)) : Map.of();
        jsRuntime = jsRuntime != null && !jsRuntime.isBlank() ? jsRuntime.trim() : null;
        maxPasses = maxPasses != null ? maxPasses : ExtractorFallbackEngine.DEFAULT_MAX_PASSES;
        retriesPerProfile = retriesPerProfile != null
                ? retriesPerProfile
                : ExtractorFallbackEngine.DEFAULT_RETRIES_PER_PROFILE;
        attemptTimeoutMinutes = attemptTimeoutMinutes != null ? attemptTimeoutMinutes : DEFAULT_ATTEMPT_TIMEOUT_MINUTES;
    }

    public static ArchiverConfig load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Config file not found: " + path);
        }
        ArchiverConfig config = MAPPER.readValue(path.toFile(), ArchiverConfig.class);
        logger.info("Loaded run configuration from {}: {} playlists, {} accounts",
                path, config.playlists().size(), config.accounts().size());
        return config;
    }

    public StrictnessMode strictnessMode() {
        return StrictnessMode.fromValue(formatStrictness);
    }

    /**
     * @throws IllegalStateException listing every problem found
     */
    public ArchiverConfig validate() {
        List<String> problems = new ArrayList<>();

        for (int i = 0; i < playlists.size(); i++) {
            PlaylistConfig playlist = playlists.get(i);
            if (isBlank(playlist.playlistId())) {
                problems.add("playlists[" + i + "].playlist_id is required");
            }
            if (isBlank(playlist.folder())) {
                problems.add("playlists[" + i + "].folder is required");
            }
            if (isBlank(playlist.account())) {
                problems.add("playlists[" + i + "].account is required");
            } else if (!accounts.containsKey(playlist.account())) {
                problems.add("playlists[" + i + "].account '" + playlist.account() + "' is not defined");
            }
        }
        if (finalFormat != null && !SUPPORTED_FINAL_FORMATS.contains(finalFormat)) {
            problems.add("final_format must be one of " + SUPPORTED_FINAL_FORMATS + ", got '" + finalFormat + "'");
        }
        try {
            StrictnessMode.fromValue(formatStrictness);
        } catch (IllegalArgumentException e) {
            problems.add("format_strictness: " + e.getMessage());
        }
        if (maxPasses < 1) {
            problems.add("max_passes must be at least 1");
        }
        if (retriesPerProfile < 1) {
            problems.add("retries_per_profile must be at least 1");
        }
        if (attemptTimeoutMinutes < 1) {
            problems.add("attempt_timeout_minutes must be at least 1");
        }
        if (jsRuntime != null && !jsRuntime.contains(":")) {
            problems.add("js_runtime must look like <name>:<path>");
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid run configuration: " + String.join("; ", problems));
        }
        return this;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
