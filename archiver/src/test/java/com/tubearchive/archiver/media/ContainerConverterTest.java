package com.tubearchive.archiver.media;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContainerConverterTest {

    @Mock
    private MediaMuxer muxer;

    @TempDir
    Path dir;

    @Test
    @DisplayName("MP4 to WebM is refused and the muxer is never called")
    void mp4ToWebmRefused() throws Exception {
        Path file = Files.writeString(dir.resolve("abc.mp4"), "mp4");

        Path result = new ContainerConverter(muxer).convert(file, "webm", "abc");

        assertEquals(file, result);
        assertTrue(Files.exists(file));
        verifyNoInteractions(muxer);
    }

    @Test
    @DisplayName("Same container or no target format is a no-op")
    void noOp() throws Exception {
        Path file = Files.writeString(dir.resolve("abc.webm"), "webm");
        ContainerConverter converter = new ContainerConverter(muxer);

        assertEquals(file, converter.convert(file, "WEBM", "abc"));
        assertEquals(file, converter.convert(file, ".webm", "abc"));
        assertEquals(file, converter.convert(file, null, "abc"));
        assertEquals(file, converter.convert(file, " ", "abc"));
        verifyNoInteractions(muxer);
    }

    @Test
    @DisplayName("Successful conversion returns the new file and deletes the original")
    void converts() throws Exception {
        Path file = Files.writeString(dir.resolve("abc.webm"), "webm");
        doAnswer(inv -> {
            MuxRequest request = inv.getArgument(0);
            Files.writeString(request.output(), "mkv");
            return null;
        }).when(muxer).mux(any());

        Path result = new ContainerConverter(muxer).convert(file, "mkv", "abc");

        assertEquals(dir.resolve("abc.mkv"), result);
        assertTrue(Files.exists(result));
        assertFalse(Files.exists(file));

        ArgumentCaptor<MuxRequest> captor = ArgumentCaptor.forClass(MuxRequest.class);
        verify(muxer).mux(captor.capture());
        assertFalse(captor.getValue().copyAllStreams());
        assertTrue(captor.getValue().metadata().isEmpty());
    }

    @Test
    @DisplayName("Failed conversion keeps the original and removes partial output")
    void failureKeepsOriginal() throws Exception {
        Path file = Files.writeString(dir.resolve("abc.webm"), "webm");
        doAnswer(inv -> {
            MuxRequest request = inv.getArgument(0);
            Files.writeString(request.output(), "partial");
            throw new MuxException("boom");
        }).when(muxer).mux(any());

        Path result = new ContainerConverter(muxer).convert(file, "mp4", "abc");

        assertEquals(file, result);
        assertTrue(Files.exists(file));
        assertFalse(Files.exists(dir.resolve("abc.mp4")));
    }

    @Test
    @DisplayName("Only the MP4 to WebM direction is refused")
    void refusalRule() {
        assertTrue(ContainerConverter.isRefused("mp4", "webm"));
        assertFalse(ContainerConverter.isRefused("webm", "mp4"));
        assertFalse(ContainerConverter.isRefused("mp4", "mkv"));
    }
}
