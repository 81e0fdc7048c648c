package com.tcgptracker.common.exception;

/**
 * Base exception for all tracker exceptions.
 */
public class TrackerException extends RuntimeException {

    public TrackerException(String message) {
        super(message);
    }

    public TrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
