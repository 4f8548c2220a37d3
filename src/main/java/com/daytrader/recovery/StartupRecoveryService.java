package com.daytrader.recovery;

import com.daytrader.broker.BrokerClient;
import com.daytrader.calendar.TradingCalendarService;
import com.daytrader.domain.enums.AlertSeverity;
import com.daytrader.domain.enums.OrderStatus;
import com.daytrader.domain.enums.OrderType;
import com.daytrader.domain.model.Order;
import com.daytrader.domain.model.OrderStatusReport;
import com.daytrader.domain.model.Position;
import com.daytrader.domain.model.Signal;
import com.daytrader.exception.PermanentRejectionException;
import com.daytrader.journal.TradeJournal;
import com.daytrader.journal.TradeRecord;
import com.daytrader.journal.TradeRecordType;
import com.daytrader.notification.NotificationService;
import com.daytrader.oms.OrderManagerProperties;
import com.daytrader.portfolio.PortfolioLedger;
import com.daytrader.risk.DailyLossGuard;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Rebuilds local state from the broker before the engine and the reconciler start.
 *
 * <p>Sequence:
 * <ol>
 *   <li>Load cash and positions from the broker (READ retry class) into the ledger. Positions
 *       are owned by {@link Position#STARTUP_OWNER} until liquidated at market open</li>
 *   <li>Restore today's orders that are still open at the broker. Candidates are the journal's
 *       NEW_ORDER lines; the broker's status decides which are open. Fills reported so far are
 *       already in the loaded snapshot, so only later fills reach the ledger</li>
 *   <li>Replay today's realized PnL from the trade journal into the daily loss guard</li>
 * </ol>
 *
 * <p>Runs as a {@link SmartLifecycle} so it completes before scheduled tasks are registered.
 * A broker failure here is fatal: the exception aborts application startup.
 */
@Service
public class StartupRecoveryService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final BrokerClient brokerClient;
    private final PortfolioLedger portfolioLedger;
    private final TradeJournal tradeJournal;
    private final DailyLossGuard dailyLossGuard;
    private final TradingCalendarService tradingCalendarService;
    private final NotificationService notificationService;
    private final OrderManagerProperties orderManagerProperties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public StartupRecoveryService(
            BrokerClient brokerClient,
            PortfolioLedger portfolioLedger,
            TradeJournal tradeJournal,
            DailyLossGuard dailyLossGuard,
            TradingCalendarService tradingCalendarService,
            NotificationService notificationService,
            OrderManagerProperties orderManagerProperties) {
        this.brokerClient = brokerClient;
        this.portfolioLedger = portfolioLedger;
        this.tradeJournal = tradeJournal;
        this.dailyLossGuard = dailyLossGuard;
        this.tradingCalendarService = tradingCalendarService;
        this.notificationService = notificationService;
        this.orderManagerProperties = orderManagerProperties;
    }

    public RecoveryResult recover() {
        return recover(tradingCalendarService.now().toLocalDate());
    }

    /**
     * Testable version: recovers with {@code today} as the current trading date.
     */
    public RecoveryResult recover(LocalDate today) {
        log.info("Starting startup recovery sequence...");
        RecoveryResult recoveryResult =
                RecoveryResult.builder().startedAt(System.currentTimeMillis()).build();

        try {
            // Step 1: Ledger from broker snapshot
            BigDecimal cash = brokerClient.getAccountCash();
            List<Position> positions = brokerClient.getPositions();
            portfolioLedger.initialize(cash, positions);
            recoveryResult.setCash(cash);
            recoveryResult.setPositionsLoaded(portfolioLedger.getPositions().size());

            // Step 2: Orders placed today and still open at the broker
            List<TradeRecord> journal = tradeJournal.read(today);
            recoveryResult.setOpenOrdersRestored(restoreOpenOrders(journal));

            // Step 3: Daily loss guard from today's journal
            BigDecimal realized = replayRealizedPnl(today, journal);
            recoveryResult.setRestoredDailyPnl(realized);

            recoveryResult.setSuccess(true);
        } catch (RuntimeException e) {
            recoveryResult.setSuccess(false);
            recoveryResult.setError(e.getMessage());
            log.error("Startup recovery failed", e);
            notificationService.notify(
                    AlertSeverity.CRITICAL, "Startup recovery failed", "Engine will not start: " + e.getMessage());
            throw e;
        }

        recoveryResult.setDurationMs(System.currentTimeMillis() - recoveryResult.getStartedAt());
        log.info(
                "Startup recovery completed: duration={}ms, cash={}, positions={}, openOrders={}, restoredDailyPnl={}",
                recoveryResult.getDurationMs(),
                recoveryResult.getCash(),
                recoveryResult.getPositionsLoaded(),
                recoveryResult.getOpenOrdersRestored(),
                recoveryResult.getRestoredDailyPnl());
        return recoveryResult;
    }

    private int restoreOpenOrders(List<TradeRecord> journal) {
        int restored = 0;
        for (TradeRecord record : journal) {
            if (record.getType() != TradeRecordType.NEW_ORDER || record.getOrderId() == null) {
                continue;
            }
            OrderStatusReport report;
            try {
                report = brokerClient.getOrderStatus(record.getOrderId());
            } catch (PermanentRejectionException e) {
                log.warn(
                        "Journalled order {} is unknown to the broker, not restored: {}",
                        record.getOrderId(),
                        e.getMessage());
                continue;
            }
            if (report.status().isTerminal()) {
                continue;
            }
            portfolioLedger.restoreOpenOrder(toOpenOrder(record, report), report.fills());
            restored++;
        }
        return restored;
    }

    private Order toOpenOrder(TradeRecord record, OrderStatusReport report) {
        Signal signal = Signal.builder()
                .strategyId(record.getStrategyId())
                .symbol(record.getSymbol())
                .side(record.getSide())
                .quantity(record.getQuantity())
                .orderType(
                        record.getOrderType() == null ? OrderType.MARKET : OrderType.valueOf(record.getOrderType()))
                .limitPrice(record.getPrice())
                .reason(record.getReason())
                .liquidation(Boolean.TRUE.equals(record.getLiquidation()))
                .build();

        BigDecimal reservedUnitCost = null;
        if (signal.isBuy()) {
            BigDecimal price =
                    record.getPrice() != null ? record.getPrice() : brokerClient.getQuote(record.getSymbol());
            reservedUnitCost = price.multiply(BigDecimal.ONE.add(orderManagerProperties.getSlippageBuffer()));
        }

        int filled = report.filledQuantity();
        return Order.builder()
                .orderId(record.getOrderId())
                .clientOrderId(record.getClientOrderId())
                .signal(signal)
                .submittedAt(record.getTimestamp())
                .status(filled > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.PENDING)
                .quantity(record.getQuantity())
                .filledQuantity(filled)
                .reservedUnitCost(reservedUnitCost)
                .build();
    }

    private BigDecimal replayRealizedPnl(LocalDate today, List<TradeRecord> journal) {
        BigDecimal realized = journal.stream()
                .filter(r -> r.getType() == TradeRecordType.FILL)
                .map(TradeRecord::getPnl)
                .filter(pnl -> pnl != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (realized.signum() != 0) {
            dailyLossGuard.recordRealizedPnl(today, realized);
        }
        return realized;
    }

    // ========================
    // LIFECYCLE
    // ========================

    @Override
    public void start() {
        recover();
        running.set(true);
    }

    @Override
    public void stop() {
        running.set(false);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 2;
    }
}
