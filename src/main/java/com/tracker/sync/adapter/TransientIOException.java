package com.tracker.sync.adapter;

/**
 * A tracker call failed in a way that may succeed on retry (timeout, rate limit, server error).
 */
public class TransientIOException extends RuntimeException {

    public TransientIOException(String message) {
        super(message);
    }

    public TransientIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
