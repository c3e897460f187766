package com.tubearchive.archiver.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramConfig(
        @JsonProperty("bot_token") String botToken,
        @JsonProperty("chat_id") String chatId
) {

    public boolean isComplete() {
        return botToken != null && !botToken.isBlank()
                && chatId != null && !chatId.isBlank();
    }
}
