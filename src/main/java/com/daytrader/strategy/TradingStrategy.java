package com.daytrader.strategy;

import com.daytrader.domain.model.Signal;
import com.daytrader.portfolio.PortfolioView;
import java.time.LocalDateTime;
import java.util.List;

/**
 * A pluggable signal producer.
 *
 * <p>The engine calls {@link #evaluate} only while the strategy's configured window is active
 * and before its liquidation deadline. Implementations must treat the portfolio as read-only,
 * must not block on I/O and must return within the engine's evaluation timeout; a call that
 * throws or times out is logged, alerted and skipped for that tick.
 */
public interface TradingStrategy {

    String getId();

    /** Symbols whose quotes go into the {@link MarketSnapshot}. */
    List<String> watchedSymbols();

    /**
     * Returns zero or more signals for this tick. Signal strategy ids must equal {@link #getId()}.
     */
    List<Signal> evaluate(MarketSnapshot marketSnapshot, PortfolioView portfolioView, LocalDateTime now);
}
