package com.my.seatbot.domain.model;

import java.util.List;

/**
 * One inbound event from the long-poll feed: either a text message or a group membership change.
 */
public record IncomingUpdate(long updateId,
                             String chatId,
                             String chatType,
                             ChatUser from,
                             String text,
                             List<ChatUser> newMembers) {

    public IncomingUpdate {
        newMembers = newMembers == null ? List.of() : List.copyOf(newMembers);
    }

    public boolean isGroupMembershipChange() {
        return !newMembers.isEmpty() && ("group".equals(chatType) || "supergroup".equals(chatType));
    }

    public boolean isPrivateText() {
        return text != null && "private".equals(chatType);
    }
}
