package com.daytrader.domain.enums;

/** Outcome of a single engine tick. */
public enum TickStatus {
    /** Not a trading day; nothing done. */
    NON_TRADING_DAY,
    /** Trading day, but before session start; nothing done. */
    WAITING,
    /** Inside today's session; phase work was dispatched. */
    ACTIVE,
    /** The clock moved back to a phase already left today; nothing done. */
    CLOCK_REGRESSED,
    /** Engine halted for the day. */
    HALTED,
    /** A stop was requested; no further ticks run. */
    STOPPED
}
