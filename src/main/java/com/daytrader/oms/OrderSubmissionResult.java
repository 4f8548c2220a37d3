package com.daytrader.oms;

import com.daytrader.domain.enums.RejectionReason;
import com.daytrader.domain.model.Order;
import lombok.Builder;
import lombok.Data;

/**
 * Result of {@link OrderManager#submit}: either the order now open at the broker, or the reason
 * the signal was dropped.
 */
@Data
@Builder
public class OrderSubmissionResult {

    private boolean accepted;

    /** The submitted order. Null if rejected. */
    private Order order;

    /** Null if accepted. */
    private RejectionReason rejectionReason;

    /** Human-readable detail for logs and alerts. Null if accepted. */
    private String message;

    public static OrderSubmissionResult accepted(Order order) {
        return OrderSubmissionResult.builder().accepted(true).order(order).build();
    }

    public static OrderSubmissionResult rejected(RejectionReason reason, String message) {
        return OrderSubmissionResult.builder()
                .accepted(false)
                .rejectionReason(reason)
                .message(message)
                .build();
    }
}
