package com.whereq.pilot.exception;

/**
 * Exception thrown when a batch system command fails or times out
 */
public class AdapterException extends RuntimeException {
    public AdapterException(String message) {
        super(message);
    }

    public AdapterException(String message, Throwable cause) {
        super(message, cause);
    }
}
