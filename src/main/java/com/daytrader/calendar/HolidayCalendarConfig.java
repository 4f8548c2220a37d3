package com.daytrader.calendar;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Exchange holiday calendar, loaded from application.properties via the
 * {@code trading-calendar} prefix.
 *
 * <p>The list is maintained by hand once a year from the exchange's published calendar.
 * Weekends are always closed and need no entry.
 */
@Component
@ConfigurationProperties(prefix = "trading-calendar")
public class HolidayCalendarConfig {

    private String exchange = "KRX";
    private Duration lateOpenOffset = Duration.ofHours(1);
    private List<Holiday> holidays = new ArrayList<>();

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public Duration getLateOpenOffset() {
        return lateOpenOffset;
    }

    public void setLateOpenOffset(Duration lateOpenOffset) {
        this.lateOpenOffset = lateOpenOffset;
    }

    public List<Holiday> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<Holiday> holidays) {
        this.holidays = holidays;
    }

    /**
     * A single entry on the trading calendar.
     */
    public static class Holiday {

        private LocalDate date;
        private String name;
        private HolidayType type = HolidayType.FULL_HOLIDAY;

        public Holiday() {}

        public Holiday(LocalDate date, String name, HolidayType type) {
            this.date = date;
            this.name = name;
            this.type = type;
        }

        public LocalDate getDate() {
            return date;
        }

        public void setDate(LocalDate date) {
            this.date = date;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public HolidayType getType() {
            return type;
        }

        public void setType(HolidayType type) {
            this.type = type;
        }
    }
}
