package com.tubearchive.archiver.notify;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Sends the run summary through the Telegram Bot API sendMessage method.
 */
public class TelegramNotifier implements Notifier {

    private static final Logger logger = LoggerFactory.getLogger(TelegramNotifier.class);

    static final String BASE_URL = "https://api.telegram.org";

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final String botToken;
    private final String chatId;

    public TelegramNotifier(String botToken, String chatId) {
        this(new OkHttpClient.Builder()
                        .connectTimeout(10, TimeUnit.SECONDS)
                        .readTimeout(10, TimeUnit.SECONDS)
                        .build(),
                BASE_URL, botToken, chatId);
    }

    TelegramNotifier(OkHttpClient httpClient, String baseUrl, String botToken, String chatId) {
        this.httpClient = httpClient;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.botToken = botToken;
        this.chatId = chatId;
    }

    @Override
    public void notify(String message) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("bot" + botToken)
                .addPathSegment("sendMessage")
                .addQueryParameter("chat_id", chatId)
                .addQueryParameter("text", message)
                .build();

        try (Response response = httpClient.newCall(new Request.Builder().url(url).get().build()).execute()) {
            if (!response.isSuccessful()) {
                logger.error("Telegram notify failed: HTTP {}", response.code());
            }
        } catch (IOException e) {
            logger.error("Telegram notify failed: {}", e.getMessage());
        }
    }
}
