package com.tubearchive.archiver.orchestrator;

import com.tubearchive.archiver.client.PlaylistSource;
import com.tubearchive.archiver.client.PlaylistSourceException;
import com.tubearchive.archiver.ledger.DownloadLedger;
import com.tubearchive.archiver.model.DownloadRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CopyLedgerWorkerTest {

    @Mock
    private PlaylistSource playlistSource;

    @TempDir
    Path dir;

    private DownloadLedger ledger;
    private CopyLedgerWorker worker;
    private Path scratch;

    @BeforeEach
    void setUp() throws SQLException, IOException {
        ledger = new DownloadLedger(dir.resolve("db.sqlite"));
        ledger.ensureSchema();
        worker = new CopyLedgerWorker(ledger);
        scratch = Files.createDirectories(dir.resolve("temp_downloads").resolve("vid1"));
    }

    @AfterEach
    void tearDown() {
        worker.close();
    }

    private CopyJob job(Path source, Path destination, boolean remove) {
        return new CopyJob("vid1", "PL1", "entry-1", "Song - Band (01-2023)", source, destination,
                scratch, remove, playlistSource);
    }

    @Test
    @DisplayName("Successful copy records success, writes the ledger and removes scratch")
    void successfulCopy() throws Exception {
        Path source = Files.writeString(scratch.resolve("vid1.webm"), "media");
        Path destination = dir.resolve("library").resolve("nested").resolve("Song.webm");
        RunContext context = new RunContext();

        CopyOutcome outcome = worker.dispatch(job(source, destination, false), context)
                .get(30, TimeUnit.SECONDS);

        assertTrue(outcome.success());
        assertEquals("media", Files.readString(destination));
        assertEquals(List.of("Song - Band (01-2023)"), context.succeeded());
        assertTrue(context.failed().isEmpty());
        Optional<DownloadRecord> row = ledger.find("vid1");
        assertTrue(row.isPresent());
        assertEquals("PL1", row.get().playlistId());
        assertEquals(destination.toString(), row.get().filePath());
        assertFalse(Files.exists(scratch));
        verifyNoInteractions(playlistSource);
    }

    @Test
    @DisplayName("Existing destination is overwritten")
    void overwritesDestination() throws Exception {
        Path source = Files.writeString(scratch.resolve("vid1.webm"), "new");
        Path destination = Files.writeString(dir.resolve("Song.webm"), "old");

        worker.dispatch(job(source, destination, false), new RunContext()).get(30, TimeUnit.SECONDS);

        assertEquals("new", Files.readString(destination));
    }

    @Test
    @DisplayName("Failed copy records a failure, writes no ledger row and still cleans scratch")
    void failedCopy() throws Exception {
        Path missing = scratch.resolve("vid1.webm");
        RunContext context = new RunContext();

        CopyOutcome outcome = worker.dispatch(job(missing, dir.resolve("Song.webm"), true), context)
                .get(30, TimeUnit.SECONDS);

        assertFalse(outcome.success());
        assertEquals(List.of("Song - Band (01-2023)"), context.failed());
        assertFalse(ledger.contains("vid1"));
        assertFalse(Files.exists(scratch));
        verifyNoInteractions(playlistSource);
    }

    @Test
    @DisplayName("Playlist entry is removed after a successful copy when configured")
    void removesFromPlaylist() throws Exception {
        Path source = Files.writeString(scratch.resolve("vid1.webm"), "media");

        worker.dispatch(job(source, dir.resolve("Song.webm"), true), new RunContext()).get(30, TimeUnit.SECONDS);

        verify(playlistSource).removeItem("entry-1");
    }

    @Test
    @DisplayName("Removal failure is logged only and the copy still counts as archived")
    void removalFailureTolerated() throws Exception {
        Path source = Files.writeString(scratch.resolve("vid1.webm"), "media");
        doThrow(new PlaylistSourceException("quota")).when(playlistSource).removeItem("entry-1");
        RunContext context = new RunContext();

        CopyOutcome outcome = worker.dispatch(job(source, dir.resolve("Song.webm"), true), context)
                .get(30, TimeUnit.SECONDS);

        assertTrue(outcome.success());
        assertEquals(1, context.succeeded().size());
        assertTrue(ledger.contains("vid1"));
    }

    @Test
    @DisplayName("Ledger insert failure does not turn an archived copy into a failure")
    void ledgerFailureTolerated() throws Exception {
        ledger.record(new DownloadRecord("vid1", "PL1", Instant.now(), "/earlier"));
        Path source = Files.writeString(scratch.resolve("vid1.webm"), "media");
        RunContext context = new RunContext();

        CopyOutcome outcome = worker.dispatch(job(source, dir.resolve("Song.webm"), false), context)
                .get(30, TimeUnit.SECONDS);

        assertTrue(outcome.success());
        assertEquals(1, context.succeeded().size());
        assertEquals("/earlier", ledger.find("vid1").orElseThrow().filePath());
    }
}
