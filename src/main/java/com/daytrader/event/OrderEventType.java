package com.daytrader.event;

/**
 * Classifies the order state change carried by an {@link OrderEvent}.
 */
public enum OrderEventType {

    /** Order accepted by the broker and registered as open. */
    PLACED,

    /** Some quantity executed; the order is still open. */
    PARTIALLY_FILLED,

    /** All requested quantity executed. */
    FILLED,

    /** Order cancelled at the broker (manually or on pending timeout). */
    CANCELLED,

    /** Order rejected by the broker after it was placed. */
    REJECTED,

    /** Order still open past the pending timeout. */
    TIMED_OUT
}
