package com.daytrader.domain.enums;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
