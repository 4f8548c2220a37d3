package com.daytrader.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes alerts to a dedicated {@code ALERTS} logger, so they can be routed to their own
 * appender. Always registered; other channels are added as beans.
 */
@Component
public class LoggingAlertChannel implements AlertChannel {

    private static final Logger alertLog = LoggerFactory.getLogger("ALERTS");

    @Override
    public String getName() {
        return "log";
    }

    @Override
    public void send(Alert alert) {
        switch (alert.getSeverity()) {
            case CRITICAL -> alertLog.error("[{}] {}: {}", alert.getSeverity(), alert.getTitle(), alert.getMessage());
            case WARNING -> alertLog.warn("[{}] {}: {}", alert.getSeverity(), alert.getTitle(), alert.getMessage());
            default -> alertLog.info("[{}] {}: {}", alert.getSeverity(), alert.getTitle(), alert.getMessage());
        }
    }
}
