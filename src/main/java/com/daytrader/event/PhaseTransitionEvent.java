package com.daytrader.event;

import com.daytrader.domain.enums.Phase;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the trading engine when the session moves from one phase to the next.
 * {@code previousPhase} is null for the first phase of a day.
 */
public class PhaseTransitionEvent extends ApplicationEvent {

    private final Phase previousPhase;
    private final Phase currentPhase;
    private final LocalDateTime transitionTime;

    public PhaseTransitionEvent(Object source, Phase previousPhase, Phase currentPhase, LocalDateTime transitionTime) {
        super(source);
        this.previousPhase = previousPhase;
        this.currentPhase = currentPhase;
        this.transitionTime = transitionTime;
    }

    public Phase getPreviousPhase() {
        return previousPhase;
    }

    public Phase getCurrentPhase() {
        return currentPhase;
    }

    public LocalDateTime getTransitionTime() {
        return transitionTime;
    }
}
