package com.daytrader.domain.enums;

public enum OrderStatus {
    PENDING,
    PARTIALLY_FILLED,
    FILLED,
    REJECTED,
    CANCELLED;

    /** Terminal statuses end the order lifecycle; the order leaves the open-order set. */
    public boolean isTerminal() {
        return this == FILLED || this == REJECTED || this == CANCELLED;
    }
}
