package com.daytrader.domain.enums;

public enum SizingPolicy {
    NONE,
    PERCENTAGE_OF_CAPITAL,
    KELLY
}
