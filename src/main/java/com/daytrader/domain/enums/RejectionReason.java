package com.daytrader.domain.enums;

/**
 * Why the order manager refused to turn a signal into an order. Rejections are
 * non-fatal: the signal is dropped and the reason is logged and notified.
 */
public enum RejectionReason {
    INVALID_SIGNAL,
    TRADING_HALTED,
    OUTSIDE_TRADING_WINDOW,
    NO_POSITION,
    /** The symbol is held by, or has an open order from, a different strategy. */
    POSITION_CONFLICT,
    PRICE_UNAVAILABLE,
    INSUFFICIENT_FUNDS,
    DUPLICATE_ORDER,
    DAILY_LOSS_LIMIT,
    POSITION_LIMIT,
    SIZE_ZERO,
    SUBMISSION_FAILED
}
