package com.daytrader.portfolio;

import com.daytrader.domain.enums.OrderStatus;
import com.daytrader.domain.model.Order;
import java.util.List;

/**
 * What a status report changed for one order: fills newly applied, the status before and
 * after, and whether the order left the open-order set.
 */
public record ReconciliationUpdate(
        Order order, OrderStatus previousStatus, List<AppliedFill> appliedFills, boolean closed) {

    public boolean statusChanged() {
        return previousStatus != order.getStatus();
    }
}
