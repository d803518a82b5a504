package com.bubblegrade.exception;

public class PipelineBusyException extends RuntimeException {

    public PipelineBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
