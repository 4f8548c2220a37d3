package com.daytrader.event;

import com.daytrader.domain.enums.OrderStatus;
import com.daytrader.domain.enums.Phase;
import com.daytrader.domain.enums.RejectionReason;
import com.daytrader.domain.model.Fill;
import com.daytrader.domain.model.Order;
import com.daytrader.domain.model.Signal;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with one typed method per
 * event, so call sites read {@code eventPublisherHelper.publishOrderPlaced(this, order)}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Phase ----

    public void publishPhaseTransition(Object source, Phase previous, Phase current, LocalDateTime at) {
        applicationEventPublisher.publishEvent(new PhaseTransitionEvent(source, previous, current, at));
    }

    public void publishTradingHalt(Object source, String reason) {
        applicationEventPublisher.publishEvent(new TradingHaltEvent(source, reason));
    }

    // ---- Order ----

    public void publishOrderPlaced(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.PLACED));
    }

    public void publishOrderUpdated(Object source, Order order, OrderEventType eventType, OrderStatus previous) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, eventType, previous));
    }

    public void publishSignalRejected(Object source, Signal signal, RejectionReason reason, String message) {
        applicationEventPublisher.publishEvent(new SignalRejectedEvent(source, signal, reason, message));
    }

    // ---- Fill ----

    public void publishFill(Object source, Order order, Fill fill, BigDecimal averageCost, BigDecimal realizedPnl) {
        applicationEventPublisher.publishEvent(new FillEvent(source, order, fill, averageCost, realizedPnl));
    }
}
