package com.tubearchive.archiver.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AccessTokensTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Reads the token field from the credential file")
    void readsToken() throws Exception {
        Path file = Files.writeString(dir.resolve("token.json"),
                "{\"token\": \"ya29.abc\", \"refresh_token\": \"1//x\", \"scopes\": []}");

        assertEquals("ya29.abc", AccessTokens.read(file));
    }

    @Test
    @DisplayName("Missing, malformed or tokenless files are auth failures")
    void failures() throws IOException {
        Path malformed = Files.writeString(dir.resolve("bad.json"), "{not json");
        Path empty = Files.writeString(dir.resolve("empty.json"), "{\"token\": \"\"}");

        assertThrows(AuthFailureException.class, () -> AccessTokens.read(dir.resolve("absent.json")));
        assertThrows(AuthFailureException.class, () -> AccessTokens.read(malformed));
        assertThrows(AuthFailureException.class, () -> AccessTokens.read(empty));
    }
}
