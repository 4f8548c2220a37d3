package com.daytrader.event;

import org.springframework.context.ApplicationEvent;

/**
 * Raised when a component detects a state corruption risk. The trading engine listens
 * synchronously and halts trading for the rest of the day.
 */
public class TradingHaltEvent extends ApplicationEvent {

    private final String reason;

    public TradingHaltEvent(Object source, String reason) {
        super(source);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
