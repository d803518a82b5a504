package com.bubblegrade.exception;

import com.bubblegrade.model.ErrorKind;

/**
 * A delegated grading or OCR service timed out or answered with a non-success status.
 */
public class BackendUnavailableException extends ScanProcessingException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message, cause);
    }
}
