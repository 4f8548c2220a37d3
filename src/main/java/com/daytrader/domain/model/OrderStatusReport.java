package com.daytrader.domain.model;

import com.daytrader.domain.enums.OrderStatus;
import java.util.List;

/**
 * Broker answer to an order status query: the current status and every fill recorded so far.
 */
public record OrderStatusReport(String orderId, OrderStatus status, List<Fill> fills, String message) {

    public OrderStatusReport {
        fills = fills != null ? List.copyOf(fills) : List.of();
    }

    public int filledQuantity() {
        return fills.stream().mapToInt(Fill::quantity).sum();
    }
}
