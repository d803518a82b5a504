package com.bubblegrade.exception;

/**
 * Storage failure surfaced to the caller; never retried inside the pipeline.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
