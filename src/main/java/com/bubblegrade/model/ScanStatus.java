package com.bubblegrade.model;

/**
 * Lifecycle of a scan: QUEUED, then PROCESSING, then one of COMPLETED, NEEDS_REVIEW or ERROR.
 * Only a correction moves a scan on afterwards, from NEEDS_REVIEW to COMPLETED.
 */
public enum ScanStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    ERROR,
    NEEDS_REVIEW
}
