package com.daytrader.event;

import com.daytrader.domain.enums.OrderStatus;
import com.daytrader.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an order changes state (placed, filled, cancelled, rejected, timed out).
 *
 * <p>Carries a snapshot of the order, the type of change and the status before the change.
 * The notification service turns these into alerts; the metrics service counts them.
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType) {
        this(source, order, eventType, null);
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** May be null for PLACED events. */
    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }
}
