package com.bubblegrade.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Status change notification pushed to listeners when a scan starts processing, finishes, or
 * is corrected.
 */
public record ScanStatusEvent(
        String type,
        UUID scanId,
        ScanStatus status,
        Integer score,
        String errorMessage,
        Instant timestamp) {

    public static final String SCAN_UPDATE = "scan_update";
    public static final String SCAN_COMPLETE = "scan_complete";
    public static final String SCAN_ERROR = "scan_error";
    public static final String SCAN_CORRECTED = "scan_corrected";

    public static ScanStatusEvent of(ScanResult scan, Instant at) {
        return switch (scan.getStatus()) {
            case QUEUED, PROCESSING -> new ScanStatusEvent(SCAN_UPDATE, scan.getId(), scan.getStatus(), null, null, at);
            case ERROR -> new ScanStatusEvent(SCAN_ERROR, scan.getId(), scan.getStatus(), null,
                    scan.getErrorMessage(), at);
            case COMPLETED, NEEDS_REVIEW -> new ScanStatusEvent(SCAN_COMPLETE, scan.getId(), scan.getStatus(),
                    scan.getOmr().score(), null, at);
        };
    }

    public static ScanStatusEvent corrected(ScanResult scan, Instant at) {
        return new ScanStatusEvent(SCAN_CORRECTED, scan.getId(), scan.getStatus(), scan.getOmr().score(), null, at);
    }
}
