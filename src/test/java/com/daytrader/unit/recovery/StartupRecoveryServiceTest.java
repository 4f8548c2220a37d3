package com.daytrader.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.daytrader.broker.BrokerClient;
import com.daytrader.calendar.TradingCalendarService;
import com.daytrader.domain.enums.AlertSeverity;
import com.daytrader.domain.enums.OrderSide;
import com.daytrader.domain.enums.OrderStatus;
import com.daytrader.domain.model.Fill;
import com.daytrader.domain.model.Order;
import com.daytrader.domain.model.OrderStatusReport;
import com.daytrader.domain.model.Position;
import com.daytrader.exception.PermanentRejectionException;
import com.daytrader.exception.TransientApiFailureException;
import com.daytrader.journal.TradeJournal;
import com.daytrader.journal.TradeRecord;
import com.daytrader.journal.TradeRecordType;
import com.daytrader.notification.NotificationService;
import com.daytrader.oms.OrderManagerProperties;
import com.daytrader.portfolio.PortfolioLedger;
import com.daytrader.portfolio.ReconciliationUpdate;
import com.daytrader.recovery.RecoveryResult;
import com.daytrader.recovery.StartupRecoveryService;
import com.daytrader.risk.DailyLossGuard;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for StartupRecoveryService.
 */
class StartupRecoveryServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 14);

    @TempDir
    Path tempDir;

    private BrokerClient brokerClient;
    private PortfolioLedger portfolioLedger;
    private TradeJournal tradeJournal;
    private DailyLossGuard dailyLossGuard;
    private NotificationService notificationService;
    private StartupRecoveryService startupRecoveryService;

    @BeforeEach
    void setUp() {
        brokerClient = mock(BrokerClient.class);
        portfolioLedger = new PortfolioLedger();
        tradeJournal = new TradeJournal(new ObjectMapper().findAndRegisterModules(), tempDir.toString());
        dailyLossGuard = mock(DailyLossGuard.class);
        notificationService = mock(NotificationService.class);
        startupRecoveryService = new StartupRecoveryService(
                brokerClient,
                portfolioLedger,
                tradeJournal,
                dailyLossGuard,
                mock(TradingCalendarService.class),
                notificationService,
                new OrderManagerProperties());

        when(brokerClient.getAccountCash()).thenReturn(new BigDecimal("2500000"));
        when(brokerClient.getPositions())
                .thenReturn(List.of(Position.builder()
                        .symbol("005930")
                        .quantity(10)
                        .averageCost(new BigDecimal("70000"))
                        .build()));
    }

    private void journalFill(OrderSide side, String pnl) {
        tradeJournal.append(TradeRecord.builder()
                .timestamp(TODAY.atTime(9, 40))
                .type(TradeRecordType.FILL)
                .symbol("000660")
                .side(side)
                .quantity(1)
                .pnl(pnl == null ? null : new BigDecimal(pnl))
                .build());
    }

    private void journalNewOrder(String orderId, OrderSide side, int quantity, String limitPrice) {
        tradeJournal.append(TradeRecord.builder()
                .timestamp(TODAY.atTime(9, 35))
                .type(TradeRecordType.NEW_ORDER)
                .strategyId("midday")
                .symbol("005930")
                .side(side)
                .quantity(quantity)
                .price(limitPrice == null ? null : new BigDecimal(limitPrice))
                .orderId(orderId)
                .clientOrderId("0K3ZMIDENT0001")
                .orderType(limitPrice == null ? "MARKET" : "LIMIT")
                .liquidation(false)
                .build());
    }

    private static Fill buyFill(String fillId, String orderId, int quantity) {
        return new Fill(
                fillId, orderId, "005930", OrderSide.BUY, quantity, new BigDecimal("69000"), TODAY.atTime(9, 36));
    }

    @Test
    @DisplayName("The ledger is loaded from the broker with positions owned by the startup owner")
    void loadsLedger() {
        RecoveryResult result = startupRecoveryService.recover(TODAY);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCash()).isEqualByComparingTo("2500000");
        assertThat(result.getPositionsLoaded()).isEqualTo(1);
        assertThat(portfolioLedger.getCash()).isEqualByComparingTo("2500000");
        assertThat(portfolioLedger.getPosition("005930"))
                .get()
                .extracting(Position::getOwningStrategyId)
                .isEqualTo(Position.STARTUP_OWNER);
    }

    @Test
    @DisplayName("An order still open at the broker is restored and only its later fills are folded")
    void restoresOpenOrder() {
        journalNewOrder("B-7", OrderSide.BUY, 10, "69000");
        Fill before = buyFill("F-1", "B-7", 4);
        when(brokerClient.getOrderStatus("B-7"))
                .thenReturn(new OrderStatusReport("B-7", OrderStatus.PARTIALLY_FILLED, List.of(before), null));

        RecoveryResult result = startupRecoveryService.recover(TODAY);

        assertThat(result.getOpenOrdersRestored()).isEqualTo(1);
        assertThat(portfolioLedger.getOpenOrders()).singleElement().satisfies(order -> {
            assertThat(order.getOrderId()).isEqualTo("B-7");
            assertThat(order.getStrategyId()).isEqualTo("midday");
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
            assertThat(order.getFilledQuantity()).isEqualTo(4);
            assertThat(order.getRemainingQuantity()).isEqualTo(6);
        });
        assertThat(portfolioLedger.hasOpenOrder("midday", "005930")).isTrue();
        // 6 remaining x 69000 x 1.05
        assertThat(portfolioLedger.getAvailableCash()).isEqualByComparingTo("2065300");

        ReconciliationUpdate update = portfolioLedger
                .applyStatusReport(
                        "B-7",
                        new OrderStatusReport(
                                "B-7", OrderStatus.FILLED, List.of(before, buyFill("F-2", "B-7", 6)), null))
                .orElseThrow();

        assertThat(update.appliedFills()).hasSize(1);
        assertThat(update.closed()).isTrue();
        assertThat(portfolioLedger.getPosition("005930")).get().extracting(Position::getQuantity).isEqualTo(16);
        assertThat(portfolioLedger.getCash()).isEqualByComparingTo("2086000");
        assertThat(portfolioLedger.getOpenOrderCount()).isZero();
    }

    @Test
    @DisplayName("Orders already closed or unknown to the broker are not restored")
    void skipsClosedAndUnknownOrders() {
        journalNewOrder("B-8", OrderSide.BUY, 5, null);
        journalNewOrder("B-9", OrderSide.SELL, 10, null);
        when(brokerClient.getOrderStatus("B-8"))
                .thenReturn(new OrderStatusReport("B-8", OrderStatus.FILLED, List.of(buyFill("F-3", "B-8", 5)), null));
        when(brokerClient.getOrderStatus("B-9")).thenThrow(new PermanentRejectionException("Unknown order id: B-9"));

        RecoveryResult result = startupRecoveryService.recover(TODAY);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOpenOrdersRestored()).isZero();
        assertThat(portfolioLedger.getOpenOrders()).isEmpty();
    }

    @Test
    @DisplayName("A restored market buy reserves cash at the current quote")
    void restoredMarketBuyUsesQuote() {
        journalNewOrder("B-10", OrderSide.BUY, 2, null);
        when(brokerClient.getOrderStatus("B-10"))
                .thenReturn(new OrderStatusReport("B-10", OrderStatus.PENDING, List.of(), null));
        when(brokerClient.getQuote("005930")).thenReturn(new BigDecimal("70000"));

        startupRecoveryService.recover(TODAY);

        assertThat(portfolioLedger.getOpenOrders())
                .singleElement()
                .extracting(Order::getReservedUnitCost)
                .satisfies(cost -> assertThat(cost).isEqualByComparingTo("73500"));
        assertThat(portfolioLedger.getAvailableCash()).isEqualByComparingTo("2353000");
    }

    @Test
    @DisplayName("Today's realized PnL is replayed into the daily loss guard")
    void replaysDailyPnl() {
        journalFill(OrderSide.BUY, null);
        journalFill(OrderSide.SELL, "-700");
        journalFill(OrderSide.SELL, "200");

        RecoveryResult result = startupRecoveryService.recover(TODAY);

        assertThat(result.getRestoredDailyPnl()).isEqualByComparingTo("-500");
        verify(dailyLossGuard).recordRealizedPnl(eq(TODAY), argThat(pnl -> pnl.compareTo(new BigDecimal("-500")) == 0));
    }

    @Test
    @DisplayName("No realized PnL today leaves the loss guard untouched")
    void nothingToReplay() {
        journalFill(OrderSide.BUY, null);

        startupRecoveryService.recover(TODAY);

        verify(dailyLossGuard, never()).recordRealizedPnl(any(), any());
    }

    @Test
    @DisplayName("A broker failure alerts and aborts startup")
    void brokerFailureAborts() {
        when(brokerClient.getAccountCash()).thenThrow(new TransientApiFailureException("connection reset"));

        assertThatThrownBy(() -> startupRecoveryService.recover(TODAY))
                .isInstanceOf(TransientApiFailureException.class)
                .hasMessageContaining("connection reset");
        verify(notificationService).notify(eq(AlertSeverity.CRITICAL), eq("Startup recovery failed"), anyString());
    }
}
