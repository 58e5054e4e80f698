package com.my.seatbot.domain.service;

import com.my.seatbot.domain.model.IncomingUpdate;
import com.my.seatbot.domain.port.in.HandleUpdateUseCase;
import com.my.seatbot.domain.port.out.TelegramUpdatePort;

import java.util.List;

/**
 * Fetches one batch of updates and hands each to the dispatcher, advancing the cursor past an
 * update before handling it. An update that fails mid-handling is not fetched again.
 */
public class TelegramUpdateService {

    private final TelegramUpdatePort telegramUpdatePort;
    private final HandleUpdateUseCase handleUpdateUseCase;
    private volatile long cursor;

    public TelegramUpdateService(TelegramUpdatePort telegramUpdatePort,
                                 HandleUpdateUseCase handleUpdateUseCase) {
        this.telegramUpdatePort = telegramUpdatePort;
        this.handleUpdateUseCase = handleUpdateUseCase;
    }

    public long pollOnce(int timeoutSeconds) {
        List<IncomingUpdate> updates = telegramUpdatePort.fetchUpdates(cursor, timeoutSeconds);
        for (IncomingUpdate update : updates) {
            cursor = Math.max(cursor, update.updateId() + 1);
            handleUpdateUseCase.handle(update);
        }
        return cursor;
    }

    public long cursor() {
        return cursor;
    }
}
