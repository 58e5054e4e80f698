package com.my.seatbot.domain.port.out;

import com.my.seatbot.domain.model.TelegramOutgoingMessage;

import java.util.Optional;

/**
 * Outbound operations against the chat platform. Implementations never throw for platform failures.
 */
public interface TelegramSendPort {

    /**
     * @return {@code true} when the platform acknowledged the message
     */
    boolean send(TelegramOutgoingMessage message);

    /**
     * Mints a new invite link. Every call produces a distinct link.
     */
    Optional<String> createInviteLink(String chatId, long expireEpochSeconds, int memberLimit);

    /**
     * Removes a member from a group now while leaving them free to join again through a new invite.
     */
    void evictButAllowRejoin(String chatId, long userId);
}
