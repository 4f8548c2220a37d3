package com.daytrader.domain.model;

import com.daytrader.domain.enums.OrderSide;
import com.daytrader.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A strategy's intent to trade. Produced and consumed within one engine tick; never persisted.
 *
 * <p>Liquidation signals are synthesised by the engine at a strategy's window deadline (or at
 * market open for carried positions) and bypass the per-strategy time gate.
 */
@Value
@Builder
public class Signal {

    String strategyId;
    String symbol;
    OrderSide side;
    int quantity;

    @Builder.Default
    OrderType orderType = OrderType.MARKET;

    /** Required for LIMIT orders, ignored for MARKET. */
    BigDecimal limitPrice;

    /** Free-text reason carried into logs and the trade journal. */
    String reason;

    boolean liquidation;

    public boolean isBuy() {
        return side == OrderSide.BUY;
    }

    public static Signal liquidation(String strategyId, String symbol, int quantity, String reason) {
        return Signal.builder()
                .strategyId(strategyId)
                .symbol(symbol)
                .side(OrderSide.SELL)
                .quantity(quantity)
                .orderType(OrderType.MARKET)
                .reason(reason)
                .liquidation(true)
                .build();
    }
}
