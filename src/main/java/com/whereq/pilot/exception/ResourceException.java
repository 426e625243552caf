package com.whereq.pilot.exception;

/**
 * Base exception for resource ledger failures caused by the caller
 */
public class ResourceException extends RuntimeException {
    public ResourceException(String message) {
        super(message);
    }

    public ResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
