package com.daytrader.calendar;

import java.time.LocalTime;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Phase boundaries of a regular trading day, properties prefix {@code daytrader.session.*}.
 *
 * <p>Each time is the inclusive start of a phase; a phase ends where the next one starts.
 * POST_MARKET runs until midnight. Boundaries must be strictly increasing, which
 * {@link TradingCalendarService} checks at construction.
 */
@Data
@Component
@ConfigurationProperties(prefix = "daytrader.session")
public class SessionScheduleConfig {

    private String timezone = "Asia/Seoul";

    private LocalTime preMarketStart = LocalTime.of(8, 50);
    private LocalTime openingStart = LocalTime.of(9, 0);
    private LocalTime middayStart = LocalTime.of(9, 30);
    private LocalTime closingPrepStart = LocalTime.of(14, 50);
    private LocalTime closingExecutionStart = LocalTime.of(15, 0);
    private LocalTime postMarketStart = LocalTime.of(15, 30);

    /** The broker's order-status feed is unreliable during the closing auction; fills are not polled. */
    private LocalTime fillBlackoutStart = LocalTime.of(15, 20);
    private LocalTime fillBlackoutEnd = LocalTime.of(15, 30);

    /** Request application shutdown after the end-of-day tasks ran. */
    private boolean autoShutdown = false;
}
