package com.my.seatbot.domain.exception;

/**
 * The update feed could not be read; the poller backs off and retries.
 */
public class TelegramUnavailableException extends RuntimeException {
    public TelegramUnavailableException(String message) {
        super(message);
    }

    public TelegramUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
