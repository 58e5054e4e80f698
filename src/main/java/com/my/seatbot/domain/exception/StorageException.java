package com.my.seatbot.domain.exception;

/**
 * A registry document could not be written.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
