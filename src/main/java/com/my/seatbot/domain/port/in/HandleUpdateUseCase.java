package com.my.seatbot.domain.port.in;

import com.my.seatbot.domain.model.IncomingUpdate;

/**
 * Entry point for every inbound update fetched by the poller.
 */
public interface HandleUpdateUseCase {
    void handle(IncomingUpdate update);
}
