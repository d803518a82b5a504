package com.bubblegrade.exception;

import com.bubblegrade.model.ScanStatus;
import java.util.UUID;

/**
 * Raised when an operation is requested on a scan whose status does not allow it.
 */
public class ScanStateException extends RuntimeException {

    public ScanStateException(UUID scanId, ScanStatus status, String operation) {
        super("Scan " + scanId + " in status " + status + " cannot be " + operation);
    }
}
