package com.tubearchive.archiver.media;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Best-effort download of a cover image. Every failure yields an empty result.
 */
public class ThumbnailFetcher {

    private static final Logger logger = LoggerFactory.getLogger(ThumbnailFetcher.class);

    private final OkHttpClient httpClient;

    public ThumbnailFetcher() {
        this(new OkHttpClient.Builder()
                .connectTimeout(15, TimeUnit.SECONDS)
                .readTimeout(15, TimeUnit.SECONDS)
                .build());
    }

    public ThumbnailFetcher(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public Optional<Path> fetch(String url, Path target) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring malformed thumbnail URL {}", url);
            return Optional.empty();
        }

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                logger.warn("Thumbnail fetch returned {} for {}", response.code(), url);
                return Optional.empty();
            }
            byte[] bytes = body.bytes();
            if (bytes.length == 0) {
                logger.warn("Thumbnail at {} was empty", url);
                return Optional.empty();
            }
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
            return Optional.of(target);
        } catch (IOException e) {
            logger.warn("Thumbnail download failed for {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }
}
