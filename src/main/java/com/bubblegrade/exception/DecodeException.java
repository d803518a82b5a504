package com.bubblegrade.exception;

import com.bubblegrade.model.ErrorKind;

public class DecodeException extends ScanProcessingException {

    public DecodeException(String message) {
        super(ErrorKind.DECODE_ERROR, message, null);
    }

    public DecodeException(String message, Throwable cause) {
        super(ErrorKind.DECODE_ERROR, message, cause);
    }
}
