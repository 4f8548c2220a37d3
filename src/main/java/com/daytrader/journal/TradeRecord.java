package com.daytrader.journal;

import com.daytrader.domain.enums.OrderSide;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of the trade journal. NEW_ORDER lines carry the order ids and reason; FILL lines carry
 * the execution and, for sells, the realized PnL in currency and as a percentage of cost.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TradeRecord {

    private LocalDateTime timestamp;
    private TradeRecordType type;
    private String strategyId;
    private String symbol;
    private OrderSide side;
    private Integer quantity;
    private BigDecimal price;
    private String orderId;
    private String clientOrderId;
    private String fillId;
    private String orderType;
    private String reason;
    private Boolean liquidation;
    private BigDecimal pnl;

    /** Realized PnL in percent of the cost basis, e.g. 2.5 for +2.5%. */
    private BigDecimal pnlPct;
}
