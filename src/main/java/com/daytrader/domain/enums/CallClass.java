package com.daytrader.domain.enums;

/**
 * Broker call classes. Each class has its own retry budget: quotes retry fast and often,
 * submissions retry rarely and only after confirming the order does not already exist.
 */
public enum CallClass {
    QUOTE,
    READ,
    SUBMIT
}
