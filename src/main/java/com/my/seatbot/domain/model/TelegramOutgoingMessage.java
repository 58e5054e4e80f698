package com.my.seatbot.domain.model;

import java.util.Objects;

/**
 * Outbound chat message. HTML is the default parse mode for everything this bot sends.
 */
public record TelegramOutgoingMessage(String chatId, String text, String parseMode) {

    public static final String HTML = "HTML";

    public TelegramOutgoingMessage {
        Objects.requireNonNull(chatId, "chatId");
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
    }

    public TelegramOutgoingMessage(String chatId, String text) {
        this(chatId, text, HTML);
    }
}
