package com.daytrader.domain.enums;

/**
 * Phases of a trading day, in chronological order.
 *
 * <pre>
 * 08:50-09:00  PRE_MARKET         -- session start, no orders
 * 09:00-09:30  OPENING            -- opening strategies, overnight liquidation
 * 09:30-14:50  MIDDAY             -- intraday strategies
 * 14:50-15:00  CLOSING_PREP       -- intraday positions flattened
 * 15:00-15:30  CLOSING_EXECUTION  -- closing-price strategies
 * 15:30-       POST_MARKET        -- end-of-day tasks, no orders
 * </pre>
 *
 * <p>Boundaries are configurable through {@code daytrader.session.*}; the times above are the
 * defaults. HALTED is never derived from the clock: the engine enters it on a detected state
 * corruption and stays there for the rest of the day.
 */
public enum Phase {
    PRE_MARKET(false),
    OPENING(true),
    MIDDAY(true),
    CLOSING_PREP(true),
    CLOSING_EXECUTION(true),
    POST_MARKET(false),
    HALTED(false);

    private final boolean marketOpen;

    Phase(boolean marketOpen) {
        this.marketOpen = marketOpen;
    }

    /** True for phases in which the exchange accepts orders. */
    public boolean isMarketOpen() {
        return marketOpen;
    }

    /** The phase that follows this one in a normal day, or null for the last one. */
    public Phase next() {
        return switch (this) {
            case PRE_MARKET -> OPENING;
            case OPENING -> MIDDAY;
            case MIDDAY -> CLOSING_PREP;
            case CLOSING_PREP -> CLOSING_EXECUTION;
            case CLOSING_EXECUTION -> POST_MARKET;
            case POST_MARKET, HALTED -> null;
        };
    }
}
