package com.daytrader.domain.enums;

public enum OrderSide {
    BUY,
    SELL
}
