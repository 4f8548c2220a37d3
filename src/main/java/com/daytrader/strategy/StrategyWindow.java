package com.daytrader.strategy;

import java.time.LocalDateTime;

/**
 * A strategy's window on one date. Entries are allowed in [start, liquidationDeadline);
 * the window itself ends at {@code end}.
 */
public record StrategyWindow(LocalDateTime start, LocalDateTime end, LocalDateTime liquidationDeadline) {

    public boolean acceptsEntries(LocalDateTime now) {
        return !now.isBefore(start) && now.isBefore(liquidationDeadline);
    }

    public boolean isPastDeadline(LocalDateTime now) {
        return !now.isBefore(liquidationDeadline);
    }
}
