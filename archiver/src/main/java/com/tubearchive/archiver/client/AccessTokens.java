package com.tubearchive.archiver.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the access token out of a previously authorized credential file.
 * Obtaining and refreshing credentials happens outside this program.
 */
public final class AccessTokens {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AccessTokens() {
    }

    public static String read(Path tokenFile) throws AuthFailureException {
        if (!Files.isRegularFile(tokenFile)) {
            throw new AuthFailureException("Token file not found: " + tokenFile);
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(tokenFile.toFile());
        } catch (IOException e) {
            throw new AuthFailureException("Token file is not readable JSON: " + tokenFile, e);
        }
        JsonNode token = root.path("token");
        if (!token.isTextual() || token.asText().isBlank()) {
            throw new AuthFailureException("Token file has no 'token' value: " + tokenFile);
        }
        return token.asText();
    }
}
