package com.daytrader.portfolio;

import com.daytrader.domain.enums.OrderSide;
import java.math.BigDecimal;

/**
 * A submission in flight: validated and counted against cash and quantity, but without a
 * broker order id yet. Replaced by an open order on success, released on failure.
 */
public record Reservation(
        String clientOrderId, String strategyId, String symbol, OrderSide side, int quantity, BigDecimal unitCost) {

    public BigDecimal committedCash() {
        if (side != OrderSide.BUY || unitCost == null) {
            return BigDecimal.ZERO;
        }
        return unitCost.multiply(BigDecimal.valueOf(quantity));
    }
}
