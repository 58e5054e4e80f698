package com.my.seatbot.domain.port.out;

import com.my.seatbot.domain.model.IncomingUpdate;

import java.util.List;

/**
 * Long-poll feed of inbound updates.
 *
 * @throws com.my.seatbot.domain.exception.TelegramUnavailableException when the feed cannot be read
 */
public interface TelegramUpdatePort {
    List<IncomingUpdate> fetchUpdates(long offset, int timeoutSeconds);
}
