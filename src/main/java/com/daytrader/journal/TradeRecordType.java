package com.daytrader.journal;

public enum TradeRecordType {
    NEW_ORDER,
    FILL
}
