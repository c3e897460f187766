package com.tubearchive.archiver.ledger;

import com.tubearchive.archiver.model.DownloadRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.Optional;
import java.util.Properties;

/**
 * SQLite-backed record of every video that reached its destination. A row's
 * presence is the only signal that a video is done; lookups happen before any
 * extraction work.
 *
 * <p>Every operation opens its own connection, so completions arriving from
 * several copy threads never share a connection or a transaction. Each insert
 * targets a distinct key and relies on SQLite's single-row atomicity.</p>
 */
public class DownloadLedger {

    private static final Logger logger = LoggerFactory.getLogger(DownloadLedger.class);

    static final String TABLE = "downloads";
    static final int BUSY_TIMEOUT_MS = 10_000;

    private final String jdbcUrl;

    public DownloadLedger(Path dbPath) {
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
    }

    /**
     * Opens a new database connection.
     */
    public Connection connect() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", String.valueOf(BUSY_TIMEOUT_MS));
        return DriverManager.getConnection(jdbcUrl, props);
    }

    public void ensureSchema() throws SQLException {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS " + TABLE + " ("
                    + "video_id TEXT PRIMARY KEY, "
                    + "playlist_id TEXT, "
                    + "downloaded_at TIMESTAMP, "
                    + "filepath TEXT)");
        }
        logger.debug("Ledger schema ready at {}", jdbcUrl);
    }

    public boolean contains(String videoId) throws SQLException {
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT 1 FROM " + TABLE + " WHERE video_id = ?")) {
            ps.setString(1, videoId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Inserts one row through a fresh connection.
     *
     * @throws SQLException including when the video is already recorded
     */
    public void record(DownloadRecord record) throws SQLException {
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(
                     "INSERT INTO " + TABLE + " (video_id, playlist_id, downloaded_at, filepath)"
                             + " VALUES (?, ?, ?, ?)")) {
            ps.setString(1, record.videoId());
            ps.setString(2, record.playlistId());
            ps.setString(3, record.downloadedAt().toString());
            ps.setString(4, record.filePath());
            ps.executeUpdate();
        }
        logger.debug("Recorded {} -> {}", record.videoId(), record.filePath());
    }

    public Optional<DownloadRecord> find(String videoId) throws SQLException {
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT video_id, playlist_id, downloaded_at, filepath FROM " + TABLE
                             + " WHERE video_id = ?")) {
            ps.setString(1, videoId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new DownloadRecord(
                        rs.getString("video_id"),
                        rs.getString("playlist_id"),
                        Instant.parse(rs.getString("downloaded_at")),
                        rs.getString("filepath")));
            }
        }
    }

    public int count() throws SQLException {
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + TABLE)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }
}
