package com.daytrader.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.daytrader.broker.BrokerClient;
import com.daytrader.calendar.HolidayCalendarConfig;
import com.daytrader.calendar.SessionScheduleConfig;
import com.daytrader.calendar.TradingCalendarService;
import com.daytrader.domain.enums.OrderSide;
import com.daytrader.domain.enums.OrderStatus;
import com.daytrader.domain.model.Fill;
import com.daytrader.domain.model.Order;
import com.daytrader.domain.model.OrderStatusReport;
import com.daytrader.domain.model.Signal;
import com.daytrader.event.EventPublisherHelper;
import com.daytrader.event.OrderEventType;
import com.daytrader.exception.PermanentRejectionException;
import com.daytrader.exception.TransientApiFailureException;
import com.daytrader.oms.FillReconciler;
import com.daytrader.oms.OrderManagerProperties;
import com.daytrader.portfolio.PortfolioLedger;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for FillReconciler: status polling, fill events, the closing-auction blackout,
 * pending timeouts and the halt on state corruption.
 */
class FillReconcilerTest {

    private static final LocalDateTime SUBMITTED = LocalDateTime.of(2026, 10, 14, 10, 0);

    private PortfolioLedger portfolioLedger;
    private BrokerClient brokerClient;
    private OrderManagerProperties orderManagerProperties;
    private EventPublisherHelper eventPublisherHelper;
    private FillReconciler fillReconciler;

    @BeforeEach
    void setUp() {
        portfolioLedger = new PortfolioLedger();
        portfolioLedger.initialize(new BigDecimal("1000000"), List.of());
        brokerClient = mock(BrokerClient.class);
        eventPublisherHelper = mock(EventPublisherHelper.class);
        orderManagerProperties = new OrderManagerProperties();

        TradingCalendarService tradingCalendarService =
                new TradingCalendarService(new HolidayCalendarConfig(), new SessionScheduleConfig());
        fillReconciler = new FillReconciler(
                portfolioLedger, brokerClient, tradingCalendarService, orderManagerProperties, eventPublisherHelper);

        portfolioLedger.registerOrder(Order.builder()
                .orderId("B-1")
                .clientOrderId("c-1")
                .signal(Signal.builder().strategyId("s1").symbol("005930").side(OrderSide.BUY).quantity(10).build())
                .submittedAt(SUBMITTED)
                .quantity(10)
                .reservedUnitCost(new BigDecimal("105"))
                .build());
    }

    private static Fill fill(String fillId, int quantity) {
        return new Fill(fillId, "B-1", "005930", OrderSide.BUY, quantity, new BigDecimal("100"), SUBMITTED);
    }

    @Nested
    @DisplayName("Fill Application")
    class FillApplication {

        @Test
        @DisplayName("Partial then full fills are applied once each and published")
        void partialThenFull() {
            when(brokerClient.getOrderStatus("B-1"))
                    .thenReturn(new OrderStatusReport("B-1", OrderStatus.PARTIALLY_FILLED, List.of(fill("F1", 4)), null))
                    .thenReturn(new OrderStatusReport(
                            "B-1", OrderStatus.FILLED, List.of(fill("F1", 4), fill("F2", 6)), null));

            assertThat(fillReconciler.reconcile(SUBMITTED.plusSeconds(5))).isEqualTo(1);
            assertThat(portfolioLedger.getPosition("005930").orElseThrow().getQuantity()).isEqualTo(4);

            assertThat(fillReconciler.reconcile(SUBMITTED.plusSeconds(10))).isEqualTo(1);
            assertThat(portfolioLedger.getPosition("005930").orElseThrow().getQuantity()).isEqualTo(10);
            assertThat(portfolioLedger.getOpenOrderCount()).isZero();

            verify(eventPublisherHelper, times(2)).publishFill(eq(fillReconciler), any(), any(), any(), any());
            verify(eventPublisherHelper).publishOrderUpdated(
                    eq(fillReconciler), any(), eq(OrderEventType.PARTIALLY_FILLED), eq(OrderStatus.PENDING));
            verify(eventPublisherHelper).publishOrderUpdated(
                    eq(fillReconciler), any(), eq(OrderEventType.FILLED), eq(OrderStatus.PARTIALLY_FILLED));
        }

        @Test
        @DisplayName("A broker rejection closes the order without fills")
        void rejected() {
            when(brokerClient.getOrderStatus("B-1"))
                    .thenReturn(new OrderStatusReport("B-1", OrderStatus.REJECTED, List.of(), "insufficient funds"));

            assertThat(fillReconciler.reconcile(SUBMITTED.plusSeconds(5))).isZero();

            assertThat(portfolioLedger.getOpenOrderCount()).isZero();
            assertThat(portfolioLedger.getCash()).isEqualByComparingTo("1000000");
            verify(eventPublisherHelper).publishOrderUpdated(
                    eq(fillReconciler), any(), eq(OrderEventType.REJECTED), eq(OrderStatus.PENDING));
        }

        @Test
        @DisplayName("A status query failure leaves the order for the next pass")
        void queryFailure() {
            when(brokerClient.getOrderStatus("B-1")).thenThrow(new TransientApiFailureException("timeout"));

            assertThat(fillReconciler.reconcile(SUBMITTED.plusSeconds(5))).isZero();
            assertThat(portfolioLedger.getOpenOrderCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("An order unknown to the broker is abandoned and published as cancelled")
        void unknownOrder() {
            when(brokerClient.getOrderStatus("B-1")).thenThrow(new PermanentRejectionException("Unknown order id"));

            fillReconciler.reconcile(SUBMITTED.plusSeconds(5));

            assertThat(portfolioLedger.getOpenOrderCount()).isZero();
            verify(eventPublisherHelper).publishOrderUpdated(
                    eq(fillReconciler), any(), eq(OrderEventType.CANCELLED), eq(OrderStatus.PENDING));
        }
    }

    @Nested
    @DisplayName("Blackout and Corruption")
    class BlackoutAndCorruption {

        @Test
        @DisplayName("No status is polled during the closing-auction blackout")
        void blackout() {
            assertThat(fillReconciler.reconcile(LocalDateTime.of(2026, 10, 14, 15, 25))).isZero();

            verify(brokerClient, never()).getOrderStatus(anyString());
        }

        @Test
        @DisplayName("An over-fill publishes a trading halt and leaves the ledger untouched")
        void corruptionHalts() {
            when(brokerClient.getOrderStatus("B-1"))
                    .thenReturn(new OrderStatusReport("B-1", OrderStatus.FILLED, List.of(fill("F1", 11)), null));

            assertThat(fillReconciler.reconcile(SUBMITTED.plusSeconds(5))).isZero();

            verify(eventPublisherHelper).publishTradingHalt(eq(fillReconciler), anyString());
            assertThat(portfolioLedger.getPosition("005930")).isEmpty();
            assertThat(portfolioLedger.getOpenOrderCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Pending Timeout")
    class PendingTimeout {

        @BeforeEach
        void stillPending() {
            when(brokerClient.getOrderStatus("B-1"))
                    .thenReturn(new OrderStatusReport("B-1", OrderStatus.PENDING, List.of(), null));
            orderManagerProperties.setPendingTimeout(Duration.ofMinutes(10));
        }

        @Test
        @DisplayName("An order pending past the timeout is alerted exactly once")
        void alertedOnce() {
            fillReconciler.reconcile(SUBMITTED.plusMinutes(5));
            fillReconciler.reconcile(SUBMITTED.plusMinutes(11));
            fillReconciler.reconcile(SUBMITTED.plusMinutes(12));

            verify(eventPublisherHelper, times(1)).publishOrderUpdated(
                    eq(fillReconciler), any(), eq(OrderEventType.TIMED_OUT), any());
            verify(brokerClient, never()).cancelOrder(anyString());
            assertThat(portfolioLedger.getOpenOrderCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("With cancel-on-timeout the remainder is cancelled at the broker")
        void cancelOnTimeout() {
            orderManagerProperties.setCancelOnTimeout(true);

            fillReconciler.reconcile(SUBMITTED.plusMinutes(11));

            verify(brokerClient).cancelOrder("B-1");
        }

        @Test
        @DisplayName("A failing cancel is logged and does not break the pass")
        void cancelFailure() {
            orderManagerProperties.setCancelOnTimeout(true);
            doThrow(new TransientApiFailureException("down")).when(brokerClient).cancelOrder("B-1");

            fillReconciler.reconcile(SUBMITTED.plusMinutes(11));

            assertThat(portfolioLedger.getOpenOrderCount()).isEqualTo(1);
        }
    }
}
