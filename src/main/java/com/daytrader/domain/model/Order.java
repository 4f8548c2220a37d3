package com.daytrader.domain.model;

import com.daytrader.domain.enums.OrderStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A broker-bound order derived from exactly one {@link Signal}.
 *
 * <p>The lifecycle starts at submission (status PENDING, orderId assigned by the broker) and ends
 * when the status turns terminal or the order is abandoned after a timeout. Orders live in the
 * ledger's open-order set until then; only the fill reconciler updates them.
 */
@Data
@Builder
public class Order {

    /** Broker-assigned order id. */
    private String orderId;

    /** Client-supplied idempotency key sent with the submission. */
    private String clientOrderId;

    private Signal signal;

    private LocalDateTime submittedAt;

    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;

    /** Quantity actually sent to the broker (after sizing and clamping). */
    private int quantity;

    private int filledQuantity;

    /**
     * Cash committed per unit for a buy (estimated price including the slippage buffer).
     * Counts against available cash while the order is open. Null for sells.
     */
    private BigDecimal reservedUnitCost;

    /** Set once a pending-timeout alert has been raised, so it fires only once. */
    private boolean timeoutAlerted;

    public String getStrategyId() {
        return signal.getStrategyId();
    }

    public String getSymbol() {
        return signal.getSymbol();
    }

    public int getRemainingQuantity() {
        return quantity - filledQuantity;
    }

    public Order copy() {
        return Order.builder()
                .orderId(orderId)
                .clientOrderId(clientOrderId)
                .signal(signal)
                .submittedAt(submittedAt)
                .status(status)
                .quantity(quantity)
                .filledQuantity(filledQuantity)
                .reservedUnitCost(reservedUnitCost)
                .timeoutAlerted(timeoutAlerted)
                .build();
    }
}
