package com.bubblegrade.exception;

import java.util.UUID;

public class ScanNotFoundException extends RuntimeException {

    public ScanNotFoundException(UUID scanId) {
        super("Scan " + scanId + " not found");
    }
}
