package com.bubblegrade.service.notification;

import com.bubblegrade.model.ScanStatusEvent;

/**
 * Outbound channel for scan status changes, e.g. a push gateway towards connected clients.
 */
public interface ScanEventPublisher {

    void publish(ScanStatusEvent event);
}
