package com.daytrader.broker;

import com.daytrader.domain.enums.OrderSide;
import com.daytrader.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Parameters of one order submission.
 *
 * <p>{@code clientOrderId} is generated by the engine before the first attempt and reused for
 * every retry of the same submission; it is the key used to ask the broker whether an earlier
 * attempt already created the order.
 */
@Data
@Builder
public class OrderRequest {

    private String clientOrderId;
    private String strategyId;
    private String symbol;
    private OrderSide side;
    private int quantity;
    private OrderType orderType;

    /** Null for MARKET orders. */
    private BigDecimal limitPrice;
}
