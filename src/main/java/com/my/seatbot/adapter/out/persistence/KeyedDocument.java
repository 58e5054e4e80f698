package com.my.seatbot.adapter.out.persistence;

/**
 * A stored entry addressed by the chat id of its recipient.
 */
interface KeyedDocument {

    String chatId();
}
