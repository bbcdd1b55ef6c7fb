package com.leaflog.event;

/**
 * Malformed event payload. Callers treat it as "no event".
 */
public class EventDecodingException extends RuntimeException {

    public EventDecodingException(String message) {
        super(message);
    }

    public EventDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
