package com.bubblegrade.model;

/**
 * Classification of fatal scan failures recorded alongside {@link ScanStatus#ERROR}.
 */
public enum ErrorKind {
    DECODE_ERROR,
    EXTRACTION_ERROR,
    BACKEND_UNAVAILABLE,
    PIPELINE_BUSY
}
