package com.bubblegrade.exception;

import com.bubblegrade.model.ErrorKind;

/**
 * OCR or OMR engine failure.
 */
public class ExtractionException extends ScanProcessingException {

    public ExtractionException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION_ERROR, message, cause);
    }
}
