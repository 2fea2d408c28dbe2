package com.grantradar.eventbus.exception;

/**
 * A record or event that cannot be encoded or decoded. Never retried.
 */
public class EventSerializationException extends RuntimeException {

    public EventSerializationException(String message) {
        super(message);
    }

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }

}
