package com.daytrader.event;

import com.daytrader.domain.enums.RejectionReason;
import com.daytrader.domain.model.Signal;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the order manager drops a signal. No order exists for a rejected signal,
 * so the signal itself is carried.
 */
public class SignalRejectedEvent extends ApplicationEvent {

    private final Signal signal;
    private final RejectionReason reason;
    private final String message;

    public SignalRejectedEvent(Object source, Signal signal, RejectionReason reason, String message) {
        super(source);
        this.signal = signal;
        this.reason = reason;
        this.message = message;
    }

    public Signal getSignal() {
        return signal;
    }

    public RejectionReason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }
}
