package com.tubearchive.archiver.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tubearchive.archiver.model.PlaylistItem;
import com.tubearchive.archiver.model.PlaylistItemsPage;
import com.tubearchive.archiver.model.VideoListResponse;
import com.tubearchive.archiver.model.VideoMetadata;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * YouTube Data API v3 client with pagination and exponential backoff retry.
 * Authenticates with a bearer token obtained elsewhere; a rejected token
 * surfaces as {@link AuthFailureException}.
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient} and {@link ObjectMapper}
 * are both thread-safe, and this class holds no mutable per-request state.</p>
 */
public class YouTubeApiClient implements PlaylistSource {

    private static final Logger logger = LoggerFactory.getLogger(YouTubeApiClient.class);

    static final String BASE_URL = "https://www.googleapis.com/youtube/v3";
    private static final long INITIAL_BACKOFF_MS = 1_000;
    private static final long MAX_BACKOFF_MS = 30_000;
    private static final int MAX_RETRIES = 4; // 1s, 2s, 4s, 8s
    private static final int PAGE_SIZE = 50;

    /** Thumbnail sizes from largest to smallest. */
    static final List<String> THUMBNAIL_PREFERENCE = List.of("maxres", "standard", "high", "medium", "default");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String accessToken;
    private final HttpUrl baseUrl;
    private final long initialBackoffMs;

    public YouTubeApiClient(String accessToken) {
        this(accessToken, defaultHttpClient(), BASE_URL, INITIAL_BACKOFF_MS);
    }

    YouTubeApiClient(String accessToken, OkHttpClient httpClient, String baseUrl, long initialBackoffMs) {
        this.accessToken = accessToken;
        this.httpClient = httpClient;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.initialBackoffMs = initialBackoffMs;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    // -------------------------------------------------------------------------
    // PlaylistSource
    // -------------------------------------------------------------------------

    /**
     * Fetches every entry of a playlist.
     * Endpoint: GET /playlistItems?part=snippet,contentDetails&playlistId={id}&maxResults=50
     */
    @Override
    public List<PlaylistItem> listItems(String playlistId) throws PlaylistSourceException {
        List<PlaylistItem> items = new ArrayList<>();
        String pageToken = null;

        do {
            HttpUrl.Builder url = baseUrl.newBuilder()
                    .addPathSegment("playlistItems")
                    .addQueryParameter("part", "snippet,contentDetails")
                    .addQueryParameter("playlistId", playlistId)
                    .addQueryParameter("maxResults", String.valueOf(PAGE_SIZE));
            if (pageToken != null) {
                url.addQueryParameter("pageToken", pageToken);
            }

            PlaylistItemsPage page = readJson(execute(buildRequest(url.build()).get().build()),
                    PlaylistItemsPage.class);
            if (page.items() != null) {
                for (PlaylistItemsPage.Entry entry : page.items()) {
                    String videoId = entry.contentDetails() != null ? entry.contentDetails().videoId() : null;
                    if (videoId == null || videoId.isBlank()) {
                        continue;
                    }
                    items.add(new PlaylistItem(videoId, playlistId, entry.id()));
                }
                logger.debug("Fetched page with {} items for playlist {}", page.items().size(), playlistId);
            }
            pageToken = page.nextPageToken();
        } while (pageToken != null && !pageToken.isBlank());

        return items;
    }

    /**
     * Fetches descriptive metadata for one video.
     * Endpoint: GET /videos?part=snippet,contentDetails&id={videoId}
     */
    @Override
    public Optional<VideoMetadata> getMetadata(String videoId) throws PlaylistSourceException {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("videos")
                .addQueryParameter("part", "snippet,contentDetails")
                .addQueryParameter("id", videoId)
                .build();

        VideoListResponse response = readJson(execute(buildRequest(url).get().build()), VideoListResponse.class);
        if (response.items() == null || response.items().isEmpty() || response.items().get(0).snippet() == null) {
            return Optional.empty();
        }
        return Optional.of(toMetadata(videoId, response.items().get(0).snippet()));
    }

    /**
     * Removes an entry from its playlist.
     * Endpoint: DELETE /playlistItems?id={entryId}
     */
    @Override
    public void removeItem(String entryId) throws PlaylistSourceException {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("playlistItems")
                .addQueryParameter("id", entryId)
                .build();
        execute(buildRequest(url).delete().build());
        logger.info("Removed playlist entry {}", entryId);
    }

    // -------------------------------------------------------------------------
    // Mapping
    // -------------------------------------------------------------------------

    static VideoMetadata toMetadata(String videoId, VideoListResponse.Snippet snippet) {
        String uploadDate = snippet.publishedAt() != null
                ? LocalDate.ofInstant(snippet.publishedAt(), ZoneOffset.UTC).format(DateTimeFormatter.BASIC_ISO_DATE)
                : "";

        return new VideoMetadata(
                snippet.title(),
                snippet.channelTitle(),
                uploadDate,
                snippet.description(),
                snippet.tags(),
                VideoMetadata.watchUrl(videoId),
                pickThumbnail(snippet.thumbnails()));
    }

    static String pickThumbnail(Map<String, VideoListResponse.Thumbnail> thumbnails) {
        if (thumbnails == null) {
            return null;
        }
        for (String size : THUMBNAIL_PREFERENCE) {
            VideoListResponse.Thumbnail thumbnail = thumbnails.get(size);
            if (thumbnail != null && thumbnail.url() != null && !thumbnail.url().isBlank()) {
                return thumbnail.url();
            }
        }
        return null;
    }

    // -------------------------------------------------------------------------
    // Core HTTP execution with retries
    // -------------------------------------------------------------------------

    Request.Builder buildRequest(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + accessToken)
                .header("Accept", "application/json");
    }

    /**
     * Executes a request with exponential backoff retry on 429 and 5xx
     * responses, returning the body (empty string for 204).
     */
    String execute(Request request) throws PlaylistSourceException {
        long backoffMs = initialBackoffMs;

        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                int statusCode = response.code();
                logger.debug("YouTube API {} {} -> {}", request.method(), request.url().encodedPath(), statusCode);

                if (statusCode == 401) {
                    throw new AuthFailureException("Access token rejected for " + request.url().encodedPath());
                }

                if (statusCode == 429 || statusCode >= 500) {
                    if (attempt == MAX_RETRIES) {
                        throw new PlaylistSourceException("Max retries exceeded for " + request.url().encodedPath()
                                + " (last status: " + statusCode + ")");
                    }
                    logger.warn("Received {} from {}. Retrying in {}ms (attempt {}/{})",
                            statusCode, request.url().encodedPath(), backoffMs, attempt + 1, MAX_RETRIES);
                    Thread.sleep(backoffMs);
                    backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
                    continue;
                }

                if (statusCode < 200 || statusCode >= 300) {
                    throw new PlaylistSourceException("YouTube API error: " + statusCode
                            + " for " + request.url().encodedPath());
                }

                ResponseBody body = response.body();
                return body != null ? body.string() : "";
            } catch (IOException e) {
                throw new PlaylistSourceException("YouTube API request failed: " + request.url().encodedPath(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PlaylistSourceException("Interrupted while backing off", e);
            }
        }

        throw new PlaylistSourceException("Exhausted retries for " + request.url().encodedPath());
    }

    private <T> T readJson(String json, Class<T> type) throws PlaylistSourceException {
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            throw new PlaylistSourceException("Unreadable YouTube API response for " + type.getSimpleName(), e);
        }
    }
}
