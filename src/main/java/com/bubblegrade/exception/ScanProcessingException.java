package com.bubblegrade.exception;

import com.bubblegrade.model.ErrorKind;

/**
 * Fatal failure that aborts the remaining pipeline steps of one scan.
 */
public abstract class ScanProcessingException extends RuntimeException {

    private final ErrorKind kind;

    protected ScanProcessingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
