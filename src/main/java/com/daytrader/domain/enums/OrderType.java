package com.daytrader.domain.enums;

/**
 * Order types the engine issues. Stop orders are not used: exits are engine-driven
 * (forced liquidation or strategy sell signals).
 */
public enum OrderType {
    MARKET,
    LIMIT
}
