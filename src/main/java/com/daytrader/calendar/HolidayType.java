package com.daytrader.calendar;

/**
 * Types of calendar entries. FULL_HOLIDAY closes the exchange for the day,
 * LATE_OPEN shifts every phase boundary of that day by the configured offset
 * (exam days on KRX open one hour late).
 */
public enum HolidayType {
    FULL_HOLIDAY,
    LATE_OPEN
}
