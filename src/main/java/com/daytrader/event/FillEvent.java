package com.daytrader.event;

import com.daytrader.domain.model.Fill;
import com.daytrader.domain.model.Order;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per fill folded into the portfolio. For sells, {@code realizedPnl} is the
 * gain or loss against the position's average cost; it is zero for buys.
 */
public class FillEvent extends ApplicationEvent {

    private final Order order;
    private final Fill fill;
    private final BigDecimal averageCost;
    private final BigDecimal realizedPnl;

    public FillEvent(Object source, Order order, Fill fill, BigDecimal averageCost, BigDecimal realizedPnl) {
        super(source);
        this.order = order;
        this.fill = fill;
        this.averageCost = averageCost;
        this.realizedPnl = realizedPnl;
    }

    public Order getOrder() {
        return order;
    }

    public Fill getFill() {
        return fill;
    }

    /** Position average cost: after the fill for buys, the cost basis sold against for sells. */
    public BigDecimal getAverageCost() {
        return averageCost;
    }

    public BigDecimal getRealizedPnl() {
        return realizedPnl;
    }
}
