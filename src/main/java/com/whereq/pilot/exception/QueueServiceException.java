package com.whereq.pilot.exception;

/**
 * Exception thrown when the remote queue service answers with an error
 */
public class QueueServiceException extends RuntimeException {
    private final int statusCode;

    public QueueServiceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public QueueServiceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
