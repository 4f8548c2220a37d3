package com.daytrader.notification;

import com.daytrader.domain.enums.AlertSeverity;

/**
 * A delivery target for alerts (chat webhook, pager, log). Implementations may throw;
 * {@link NotificationService} isolates every channel so one failing transport never blocks
 * the others or the engine.
 */
public interface AlertChannel {

    String getName();

    /** Alerts below this severity are not sent to the channel. */
    default AlertSeverity getMinimumSeverity() {
        return AlertSeverity.INFO;
    }

    void send(Alert alert);
}
