package com.daytrader.notification;

import com.daytrader.domain.enums.AlertSeverity;
import com.daytrader.domain.model.Fill;
import com.daytrader.domain.model.Order;
import com.daytrader.domain.model.Signal;
import com.daytrader.event.FillEvent;
import com.daytrader.event.OrderEvent;
import com.daytrader.event.OrderEventType;
import com.daytrader.event.SignalRejectedEvent;
import java.math.RoundingMode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Central alert service. {@link #notify(AlertSeverity, String, String)} is fire-and-forget:
 * channel failures are logged and never propagate to the caller.
 *
 * <p>Also listens for order, rejection and fill events so that every rejection and every
 * fill produces a human-readable notification. Listeners run on the {@code eventExecutor}
 * pool to keep delivery off the engine and reconciler threads.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final List<AlertChannel> alertChannels;

    public NotificationService(List<AlertChannel> alertChannels) {
        this.alertChannels = alertChannels;
    }

    public void notify(AlertSeverity severity, String title, String body) {
        notify(Alert.builder().severity(severity).title(title).message(body).build());
    }

    public void notify(Alert alert) {
        for (AlertChannel channel : alertChannels) {
            if (alert.getSeverity().compareTo(channel.getMinimumSeverity()) < 0) {
                continue;
            }
            try {
                channel.send(alert);
            } catch (Exception e) {
                log.error("Failed to send alert '{}' via {}: {}", alert.getTitle(), channel.getName(), e.getMessage());
            }
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onSignalRejected(SignalRejectedEvent event) {
        Signal signal = event.getSignal();
        notify(
                AlertSeverity.WARNING,
                "Signal Rejected",
                String.format(
                        "[%s] %s %s x%d rejected: %s (%s)",
                        signal.getStrategyId(),
                        signal.getSide(),
                        signal.getSymbol(),
                        signal.getQuantity(),
                        event.getReason(),
                        event.getMessage()));
    }

    @Async("eventExecutor")
    @EventListener
    public void onOrderEvent(OrderEvent event) {
        Order order = event.getOrder();
        if (event.getEventType() == OrderEventType.PLACED) {
            notify(
                    AlertSeverity.INFO,
                    "Order Placed",
                    String.format(
                            "[%s] %s %s x%d (%s) id=%s",
                            order.getStrategyId(),
                            order.getSignal().getSide(),
                            order.getSymbol(),
                            order.getQuantity(),
                            order.getSignal().getOrderType(),
                            order.getOrderId()));
        } else if (event.getEventType() == OrderEventType.REJECTED
                || event.getEventType() == OrderEventType.CANCELLED) {
            notify(
                    AlertSeverity.WARNING,
                    "Order " + event.getEventType().name(),
                    String.format(
                            "[%s] %s %s id=%s filled %d/%d",
                            order.getStrategyId(),
                            order.getSignal().getSide(),
                            order.getSymbol(),
                            order.getOrderId(),
                            order.getFilledQuantity(),
                            order.getQuantity()));
        } else if (event.getEventType() == OrderEventType.TIMED_OUT) {
            notify(
                    AlertSeverity.WARNING,
                    "Order Pending Too Long",
                    String.format(
                            "[%s] %s id=%s still %s since %s",
                            order.getStrategyId(),
                            order.getSymbol(),
                            order.getOrderId(),
                            order.getStatus(),
                            order.getSubmittedAt()));
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onFill(FillEvent event) {
        Fill fill = event.getFill();
        String pnl = event.getRealizedPnl() != null && event.getRealizedPnl().signum() != 0
                ? " pnl=" + event.getRealizedPnl().setScale(0, RoundingMode.HALF_UP)
                : "";
        notify(
                AlertSeverity.INFO,
                "Order Filled",
                String.format(
                        "[%s] %s %s x%d @ %s%s",
                        event.getOrder().getStrategyId(),
                        fill.side(),
                        fill.symbol(),
                        fill.quantity(),
                        fill.price().stripTrailingZeros().toPlainString(),
                        pnl));
    }
}
