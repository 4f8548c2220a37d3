package com.daytrader.oms;

import com.daytrader.broker.BrokerClient;
import com.daytrader.calendar.TradingCalendarService;
import com.daytrader.domain.enums.OrderStatus;
import com.daytrader.domain.model.Order;
import com.daytrader.domain.model.OrderStatusReport;
import com.daytrader.event.EventPublisherHelper;
import com.daytrader.event.OrderEventType;
import com.daytrader.exception.PermanentRejectionException;
import com.daytrader.exception.StateCorruptionException;
import com.daytrader.portfolio.AppliedFill;
import com.daytrader.portfolio.PortfolioLedger;
import com.daytrader.portfolio.ReconciliationUpdate;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Closes the loop between submitted orders and confirmed fills.
 *
 * <p>Runs on its own fixed delay, shorter than the engine tick, so fills are in the ledger
 * before the next liquidation or strategy decision. Each pass:
 * <ol>
 *   <li>Queries the broker for the status of every open order (READ retry class)</li>
 *   <li>Folds fills not seen before into the ledger, the only path that mutates cash and positions</li>
 *   <li>Publishes a fill event per applied fill and an order event per status change</li>
 *   <li>Alerts once for orders pending past the timeout, cancelling them if configured</li>
 * </ol>
 *
 * <p>Query failures are logged and the order is retried on the next pass. A
 * {@link StateCorruptionException} from the ledger halts trading through a
 * {@link com.daytrader.event.TradingHaltEvent}; the pass stops at that order.
 */
@Component
public class FillReconciler {

    private static final Logger log = LoggerFactory.getLogger(FillReconciler.class);

    private final PortfolioLedger portfolioLedger;
    private final BrokerClient brokerClient;
    private final TradingCalendarService tradingCalendarService;
    private final OrderManagerProperties orderManagerProperties;
    private final EventPublisherHelper eventPublisherHelper;

    public FillReconciler(
            PortfolioLedger portfolioLedger,
            BrokerClient brokerClient,
            TradingCalendarService tradingCalendarService,
            OrderManagerProperties orderManagerProperties,
            EventPublisherHelper eventPublisherHelper) {
        this.portfolioLedger = portfolioLedger;
        this.brokerClient = brokerClient;
        this.tradingCalendarService = tradingCalendarService;
        this.orderManagerProperties = orderManagerProperties;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Scheduled(
            fixedDelayString = "${daytrader.reconciliation.poll-interval:5000}",
            initialDelayString = "${daytrader.reconciliation.initial-delay:5000}")
    public void poll() {
        reconcile(tradingCalendarService.now());
    }

    /**
     * Testable version: runs one reconciliation pass as of {@code now}.
     *
     * @return the number of fills applied in this pass
     */
    public int reconcile(LocalDateTime now) {
        if (tradingCalendarService.isInFillBlackout(now)) {
            log.debug("Fill blackout at {}, skipping reconciliation", now.toLocalTime());
            return 0;
        }

        List<Order> openOrders = portfolioLedger.getOpenOrders();
        if (openOrders.isEmpty()) {
            return 0;
        }

        int applied = 0;
        for (Order order : openOrders) {
            try {
                applied += reconcileOrder(order);
            } catch (StateCorruptionException e) {
                log.error(
                        "State corruption while reconciling order {}: {} {}",
                        order.getOrderId(),
                        e.getMessage(),
                        e.getDetails());
                eventPublisherHelper.publishTradingHalt(this, e.getMessage());
                return applied;
            }
            checkTimeout(order, now);
        }
        return applied;
    }

    private int reconcileOrder(Order order) {
        OrderStatusReport report;
        try {
            report = brokerClient.getOrderStatus(order.getOrderId());
        } catch (PermanentRejectionException e) {
            log.error("Broker does not know order {}, abandoning it: {}", order.getOrderId(), e.getMessage());
            portfolioLedger
                    .abandonOrder(order.getOrderId())
                    .ifPresent(abandoned -> eventPublisherHelper.publishOrderUpdated(
                            this, abandoned, OrderEventType.CANCELLED, order.getStatus()));
            return 0;
        } catch (RuntimeException e) {
            log.warn("Status query failed for order {}, retrying next pass: {}", order.getOrderId(), e.getMessage());
            return 0;
        }

        Optional<ReconciliationUpdate> result = portfolioLedger.applyStatusReport(order.getOrderId(), report);
        if (result.isEmpty()) {
            return 0;
        }

        ReconciliationUpdate update = result.get();
        for (AppliedFill appliedFill : update.appliedFills()) {
            log.info(
                    "Fill applied: {} {} x{} @ {} [order={}, strategy={}, realizedPnl={}]",
                    appliedFill.fill().side(),
                    appliedFill.fill().symbol(),
                    appliedFill.fill().quantity(),
                    appliedFill.fill().price(),
                    order.getOrderId(),
                    order.getStrategyId(),
                    appliedFill.realizedPnl());
            eventPublisherHelper.publishFill(
                    this, update.order(), appliedFill.fill(), appliedFill.averageCost(), appliedFill.realizedPnl());
        }

        if (update.statusChanged()) {
            OrderEventType eventType = toEventType(update.order().getStatus());
            if (eventType != null) {
                eventPublisherHelper.publishOrderUpdated(this, update.order(), eventType, update.previousStatus());
            }
            if (update.closed()) {
                log.info(
                        "Order {} closed with status {} ({}/{} filled)",
                        order.getOrderId(),
                        update.order().getStatus(),
                        update.order().getFilledQuantity(),
                        update.order().getQuantity());
            }
        }
        return update.appliedFills().size();
    }

    private void checkTimeout(Order order, LocalDateTime now) {
        if (order.isTimeoutAlerted() || order.getSubmittedAt() == null) {
            return;
        }
        Duration elapsed = Duration.between(order.getSubmittedAt(), now);
        if (elapsed.compareTo(orderManagerProperties.getPendingTimeout()) <= 0) {
            return;
        }

        // Re-read: the order may have closed during this pass
        Optional<Order> current = portfolioLedger.getOpenOrders().stream()
                .filter(o -> o.getOrderId().equals(order.getOrderId()))
                .findFirst();
        if (current.isEmpty()) {
            return;
        }

        log.warn(
                "Order timeout: orderId={}, symbol={}, strategy={}, elapsed={}s, filled={}/{}",
                order.getOrderId(),
                order.getSymbol(),
                order.getStrategyId(),
                elapsed.toSeconds(),
                current.get().getFilledQuantity(),
                current.get().getQuantity());
        portfolioLedger.markTimeoutAlerted(order.getOrderId());
        eventPublisherHelper.publishOrderUpdated(
                this, current.get(), OrderEventType.TIMED_OUT, current.get().getStatus());

        if (orderManagerProperties.isCancelOnTimeout()) {
            try {
                brokerClient.cancelOrder(order.getOrderId());
                log.info("Cancel requested for timed-out order {}", order.getOrderId());
            } catch (RuntimeException e) {
                log.error("Failed to cancel timed-out order {}", order.getOrderId(), e);
            }
        }
    }

    private OrderEventType toEventType(OrderStatus status) {
        return switch (status) {
            case PARTIALLY_FILLED -> OrderEventType.PARTIALLY_FILLED;
            case FILLED -> OrderEventType.FILLED;
            case CANCELLED -> OrderEventType.CANCELLED;
            case REJECTED -> OrderEventType.REJECTED;
            case PENDING -> null;
        };
    }
}
