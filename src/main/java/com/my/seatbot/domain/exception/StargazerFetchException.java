package com.my.seatbot.domain.exception;

public class StargazerFetchException extends RuntimeException {
    public StargazerFetchException(String message) {
        super(message);
    }

    public StargazerFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
