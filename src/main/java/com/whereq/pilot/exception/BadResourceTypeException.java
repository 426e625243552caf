package com.whereq.pilot.exception;

/**
 * Exception thrown for an unknown resource dimension or a value that cannot be coerced
 */
public class BadResourceTypeException extends ResourceException {
    public BadResourceTypeException(String message) {
        super(message);
    }

    public BadResourceTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
