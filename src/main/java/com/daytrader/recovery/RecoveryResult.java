package com.daytrader.recovery;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of the startup recovery sequence.
 */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    private BigDecimal cash;
    private int positionsLoaded;

    /** Today's orders found still open at the broker and put back into the ledger. */
    private int openOrdersRestored;

    /** Realized PnL of today's journal, replayed into the daily loss guard. */
    private BigDecimal restoredDailyPnl;
}
