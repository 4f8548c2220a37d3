package com.daytrader.domain.model;

import com.daytrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * An immutable broker-confirmed execution against an order. The fill id is the broker's
 * execution id and is used to apply each fill exactly once.
 */
public record Fill(
        String fillId,
        String orderId,
        String symbol,
        OrderSide side,
        int quantity,
        BigDecimal price,
        LocalDateTime timestamp) {

    public BigDecimal notional() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
