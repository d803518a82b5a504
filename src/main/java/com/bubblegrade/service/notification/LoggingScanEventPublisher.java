package com.bubblegrade.service.notification;

import com.bubblegrade.model.ScanStatusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publisher used when no push channel is wired in; events only reach the log.
 */
public class LoggingScanEventPublisher implements ScanEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingScanEventPublisher.class);

    @Override
    public void publish(ScanStatusEvent event) {
        log.info("event {} scan={} status={} score={}", event.type(), event.scanId(), event.status(), event.score());
    }
}
