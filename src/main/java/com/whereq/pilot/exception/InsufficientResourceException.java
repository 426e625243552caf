package com.whereq.pilot.exception;

/**
 * Exception thrown when a claim asks for more than is available
 */
public class InsufficientResourceException extends ResourceException {
    public InsufficientResourceException(String message) {
        super(message);
    }
}
