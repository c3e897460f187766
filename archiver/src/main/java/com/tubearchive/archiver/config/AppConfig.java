package com.tubearchive.archiver.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Process-level settings read from environment variables and an optional
 * .env file using dotenv-java: where the archiver keeps its data, which run
 * configuration to load, and which external binaries to invoke.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final String DEFAULT_DATA_DIR = "data";
    static final String DEFAULT_YT_DLP = "yt-dlp";
    static final String DEFAULT_FFMPEG = "ffmpeg";

    private final String dataDir;
    private final String configPath;
    private final String ytDlpPath;
    private final String ffmpegPath;
    private final String jsRuntime;

    public AppConfig() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        this.dataDir = resolve(dotenv, "TUBEARCHIVE_DATA_DIR", DEFAULT_DATA_DIR);
        this.configPath = resolve(dotenv, "TUBEARCHIVE_CONFIG",
                Path.of(dataDir, "config", "config.json").toString());
        this.ytDlpPath = resolve(dotenv, "YT_DLP_PATH", DEFAULT_YT_DLP);
        this.ffmpegPath = resolve(dotenv, "FFMPEG_PATH", DEFAULT_FFMPEG);
        this.jsRuntime = resolveOptional(dotenv, "YT_DLP_JS_RUNTIME");

        validate();

        logger.info("Configuration loaded: dataDir={}, config={}, yt-dlp={}, ffmpeg={}",
                dataDir, configPath, ytDlpPath, ffmpegPath);
    }

    /**
     * Constructor for testing — accepts values directly.
     */
    public AppConfig(String dataDir, String configPath, String ytDlpPath, String ffmpegPath,
                     String jsRuntime) {
        this.dataDir = dataDir;
        this.configPath = configPath;
        this.ytDlpPath = ytDlpPath;
        this.ffmpegPath = ffmpegPath;
        this.jsRuntime = jsRuntime;

        validate();
    }

    private void validate() {
        StringBuilder missing = new StringBuilder();
        if (isBlank(dataDir)) missing.append("TUBEARCHIVE_DATA_DIR ");
        if (isBlank(configPath)) missing.append("TUBEARCHIVE_CONFIG ");
        if (isBlank(ytDlpPath)) missing.append("YT_DLP_PATH ");
        if (isBlank(ffmpegPath)) missing.append("FFMPEG_PATH ");

        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Missing required environment variables: " + missing.toString().trim());
        }
    }

    private static String resolve(Dotenv dotenv, String key, String defaultValue) {
        String value = resolveOptional(dotenv, key);
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    private static String resolveOptional(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        return dotenv.get(key);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getDataDir() {
        return dataDir;
    }

    public String getConfigPath() {
        return configPath;
    }

    public String getYtDlpPath() {
        return ytDlpPath;
    }

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    /**
     * JS runtime hint from the environment, or null when unset.
     */
    public String getJsRuntime() {
        return jsRuntime;
    }
}
