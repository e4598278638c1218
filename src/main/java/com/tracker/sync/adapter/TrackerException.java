package com.tracker.sync.adapter;

/**
 * A tracker call failed permanently: the request was rejected or the response made no sense.
 */
public class TrackerException extends RuntimeException {

    public TrackerException(String message) {
        super(message);
    }

    public TrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
