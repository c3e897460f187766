package com.tubearchive.archiver.notify;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TelegramNotifierTest {

    private MockWebServer server;
    private TelegramNotifier notifier;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        notifier = new TelegramNotifier(new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(5, TimeUnit.SECONDS)
                .build(), server.url("/").toString(), "123:abc", "42");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Sends the message to the bot's sendMessage endpoint")
    void sendsMessage() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{\"ok\": true}"));

        notifier.notify("TubeArchive Summary\n✔ Success: 1");

        RecordedRequest request = server.takeRequest();
        assertEquals("/bot123:abc/sendMessage", request.getRequestUrl().encodedPath());
        assertEquals("42", request.getRequestUrl().queryParameter("chat_id"));
        assertEquals("TubeArchive Summary\n✔ Success: 1", request.getRequestUrl().queryParameter("text"));
    }

    @Test
    @DisplayName("HTTP errors are logged, not thrown")
    void errorsSwallowedAfterLogging() {
        server.enqueue(new MockResponse().setResponseCode(400));

        assertDoesNotThrow(() -> notifier.notify("hello"));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    @DisplayName("Unreachable server is logged, not thrown")
    void unreachable() {
        TelegramNotifier offline = new TelegramNotifier(new OkHttpClient.Builder()
                .connectTimeout(1, TimeUnit.SECONDS)
                .build(), "http://127.0.0.1:1/", "123:abc", "42");

        assertDoesNotThrow(() -> offline.notify("hello"));
    }

    @Test
    @DisplayName("Disabled notifier does nothing")
    void none() {
        assertDoesNotThrow(() -> Notifier.none().notify("anything"));
    }
}
