package com.daytrader.notification;

import com.daytrader.domain.enums.AlertSeverity;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * An alert routed through the notification channels.
 */
@Data
@Builder
public class Alert {

    private AlertSeverity severity;
    private String title;
    private String message;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();
}
