package com.daytrader.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.daytrader.broker.BrokerClient;
import com.daytrader.broker.MarketDataService;
import com.daytrader.broker.OrderRequest;
import com.daytrader.calendar.HolidayCalendarConfig;
import com.daytrader.calendar.SessionScheduleConfig;
import com.daytrader.calendar.TradingCalendarService;
import com.daytrader.domain.enums.OrderSide;
import com.daytrader.domain.enums.OrderType;
import com.daytrader.domain.enums.RejectionReason;
import com.daytrader.domain.model.Position;
import com.daytrader.domain.model.Signal;
import com.daytrader.event.EventPublisherHelper;
import com.daytrader.exception.PermanentRejectionException;
import com.daytrader.exception.TransientApiFailureException;
import com.daytrader.notification.FailureEscalator;
import com.daytrader.oms.ClientOrderIdGenerator;
import com.daytrader.oms.OrderManager;
import com.daytrader.oms.OrderManagerProperties;
import com.daytrader.oms.OrderSubmissionResult;
import com.daytrader.oms.RecentOrderGuard;
import com.daytrader.portfolio.PortfolioLedger;
import com.daytrader.risk.DailyLossGuard;
import com.daytrader.risk.RiskProperties;
import com.daytrader.sizing.PassThroughSizer;
import com.daytrader.sizing.PositionSizer;
import com.daytrader.sizing.PositionSizerFactory;
import com.daytrader.strategy.StrategyRegistry;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for OrderManager covering every step of the validation pipeline, reservation
 * accounting, and the handling of broker submission failures.
 */
class OrderManagerTest {

    private static final LocalDateTime MIDDAY = LocalDateTime.of(2026, 10, 14, 10, 0);
    private static final LocalDateTime PRE_MARKET = LocalDateTime.of(2026, 10, 14, 8, 55);
    private static final String STRATEGY = "midday-breakout";
    private static final String SYMBOL = "005930";

    private PortfolioLedger portfolioLedger;
    private BrokerClient brokerClient;
    private MarketDataService marketDataService;
    private StrategyRegistry strategyRegistry;
    private PositionSizerFactory positionSizerFactory;
    private DailyLossGuard dailyLossGuard;
    private RiskProperties riskProperties;
    private OrderManagerProperties orderManagerProperties;
    private FailureEscalator failureEscalator;
    private EventPublisherHelper eventPublisherHelper;
    private OrderManager orderManager;

    @BeforeEach
    void setUp() {
        portfolioLedger = new PortfolioLedger();
        portfolioLedger.initialize(new BigDecimal("1000000"), List.of());

        brokerClient = mock(BrokerClient.class);
        marketDataService = mock(MarketDataService.class);
        strategyRegistry = mock(StrategyRegistry.class);
        positionSizerFactory = mock(PositionSizerFactory.class);
        dailyLossGuard = mock(DailyLossGuard.class);
        failureEscalator = mock(FailureEscalator.class);
        eventPublisherHelper = mock(EventPublisherHelper.class);
        riskProperties = new RiskProperties();
        orderManagerProperties = new OrderManagerProperties();

        when(strategyRegistry.isEntryPermitted(anyString(), any())).thenReturn(true);
        when(marketDataService.getQuote(SYMBOL)).thenReturn(Optional.of(new BigDecimal("70000")));
        when(brokerClient.placeOrder(any())).thenReturn("B-1");
        when(positionSizerFactory.getActiveSizer()).thenReturn(new PassThroughSizer());

        createOrderManager();
    }

    private void createOrderManager() {
        TradingCalendarService tradingCalendarService =
                new TradingCalendarService(new HolidayCalendarConfig(), new SessionScheduleConfig());
        orderManager = new OrderManager(
                portfolioLedger,
                brokerClient,
                marketDataService,
                tradingCalendarService,
                strategyRegistry,
                positionSizerFactory,
                new ClientOrderIdGenerator("TEST"),
                new RecentOrderGuard(orderManagerProperties),
                dailyLossGuard,
                riskProperties,
                orderManagerProperties,
                failureEscalator,
                eventPublisherHelper);
    }

    private static Signal buy(int quantity) {
        return Signal.builder().strategyId(STRATEGY).symbol(SYMBOL).side(OrderSide.BUY).quantity(quantity).build();
    }

    private static Signal sell(int quantity) {
        return Signal.builder().strategyId(STRATEGY).symbol(SYMBOL).side(OrderSide.SELL).quantity(quantity).build();
    }

    private void holdPosition(String owner, int quantity) {
        portfolioLedger.initialize(new BigDecimal("1000000"), List.of(Position.builder()
                .symbol(SYMBOL)
                .quantity(quantity)
                .averageCost(new BigDecimal("69000"))
                .owningStrategyId(owner)
                .build()));
    }

    @Nested
    @DisplayName("Accepted Orders")
    class Accepted {

        @Test
        @DisplayName("A valid buy is submitted with a client order id and committed against cash")
        void validBuy() {
            OrderSubmissionResult result = orderManager.submit(buy(10), MIDDAY);

            assertThat(result.isAccepted()).isTrue();
            assertThat(result.getOrder().getOrderId()).isEqualTo("B-1");
            assertThat(result.getOrder().getClientOrderId()).startsWith("TESTMID");

            ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
            verify(brokerClient).placeOrder(captor.capture());
            assertThat(captor.getValue().getQuantity()).isEqualTo(10);
            assertThat(captor.getValue().getClientOrderId()).isEqualTo(result.getOrder().getClientOrderId());

            // 10 x 70000 x 1.05
            assertThat(portfolioLedger.getAvailableCash()).isEqualByComparingTo("265000");
            assertThat(portfolioLedger.getCash()).isEqualByComparingTo("1000000");
            assertThat(portfolioLedger.hasOpenOrder(STRATEGY, SYMBOL)).isTrue();
            verify(eventPublisherHelper).publishOrderPlaced(eq(orderManager), any());
        }

        @Test
        @DisplayName("A LIMIT buy is priced at its limit without a quote lookup")
        void limitBuyUsesLimitPrice() {
            Signal limit = Signal.builder()
                    .strategyId(STRATEGY)
                    .symbol(SYMBOL)
                    .side(OrderSide.BUY)
                    .quantity(5)
                    .orderType(OrderType.LIMIT)
                    .limitPrice(new BigDecimal("60000"))
                    .build();

            assertThat(orderManager.submit(limit, MIDDAY).isAccepted()).isTrue();
            verify(marketDataService, never()).getQuote(anyString());
        }

        @Test
        @DisplayName("Sells larger than the held quantity are clamped to it")
        void sellClamped() {
            holdPosition(STRATEGY, 10);

            OrderSubmissionResult result = orderManager.submit(sell(15), MIDDAY);

            assertThat(result.isAccepted()).isTrue();
            assertThat(result.getOrder().getQuantity()).isEqualTo(10);
        }

        @Test
        @DisplayName("The sizer may reduce a buy")
        void sizerReduces() {
            PositionSizer sizer = mock(PositionSizer.class);
            when(sizer.maxQuantity(any())).thenReturn(3);
            when(positionSizerFactory.getActiveSizer()).thenReturn(sizer);

            OrderSubmissionResult result = orderManager.submit(buy(10), MIDDAY);

            assertThat(result.getOrder().getQuantity()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Shape and Time Gate")
    class TimeGate {

        @Test
        @DisplayName("Non-positive quantity and LIMIT without price are invalid")
        void invalidShape() {
            assertThat(orderManager.submit(buy(0), MIDDAY).getRejectionReason())
                    .isEqualTo(RejectionReason.INVALID_SIGNAL);

            Signal limitWithoutPrice = Signal.builder()
                    .strategyId(STRATEGY).symbol(SYMBOL).side(OrderSide.BUY).quantity(1).orderType(OrderType.LIMIT)
                    .build();
            assertThat(orderManager.submit(limitWithoutPrice, MIDDAY).getRejectionReason())
                    .isEqualTo(RejectionReason.INVALID_SIGNAL);
        }

        @Test
        @DisplayName("Signals outside the strategy's window are rejected")
        void outsideStrategyWindow() {
            when(strategyRegistry.isEntryPermitted(STRATEGY, MIDDAY)).thenReturn(false);

            OrderSubmissionResult result = orderManager.submit(buy(1), MIDDAY);

            assertThat(result.getRejectionReason()).isEqualTo(RejectionReason.OUTSIDE_TRADING_WINDOW);
            verify(eventPublisherHelper).publishSignalRejected(
                    eq(orderManager), any(), eq(RejectionReason.OUTSIDE_TRADING_WINDOW), anyString());
            verify(brokerClient, never()).placeOrder(any());
        }

        @Test
        @DisplayName("Nothing is submitted while the market is closed")
        void marketClosed() {
            assertThat(orderManager.submit(buy(1), PRE_MARKET).getRejectionReason())
                    .isEqualTo(RejectionReason.OUTSIDE_TRADING_WINDOW);
        }

        @Test
        @DisplayName("Liquidation signals bypass the strategy window but not the market hours")
        void liquidationBypassesWindow() {
            holdPosition(STRATEGY, 10);
            when(strategyRegistry.isEntryPermitted(anyString(), any())).thenReturn(false);
            Signal liquidation = Signal.liquidation(STRATEGY, SYMBOL, 10, "deadline");

            assertThat(orderManager.submit(liquidation, PRE_MARKET).getRejectionReason())
                    .isEqualTo(RejectionReason.OUTSIDE_TRADING_WINDOW);

            OrderSubmissionResult result = orderManager.submit(liquidation, MIDDAY);
            assertThat(result.isAccepted()).isTrue();
            assertThat(result.getOrder().getClientOrderId()).contains("LIQ");
        }

        @Test
        @DisplayName("A halted order manager rejects everything until resumed")
        void halted() {
            orderManager.haltTrading("ledger corruption");

            assertThat(orderManager.isHalted()).isTrue();
            assertThat(orderManager.submit(buy(1), MIDDAY).getRejectionReason())
                    .isEqualTo(RejectionReason.TRADING_HALTED);

            orderManager.resumeTrading();
            assertThat(orderManager.submit(buy(1), MIDDAY).isAccepted()).isTrue();
        }
    }

    @Nested
    @DisplayName("Ledger Checks")
    class LedgerChecks {

        @Test
        @DisplayName("Buy needing more than available cash including the slippage buffer is rejected")
        void insufficientFunds() {
            portfolioLedger.initialize(new BigDecimal("100000"), List.of());
            orderManagerProperties.setSlippageBuffer(new BigDecimal("0.07"));
            when(marketDataService.getQuote(SYMBOL)).thenReturn(Optional.of(new BigDecimal("2200")));

            OrderSubmissionResult result = orderManager.submit(buy(50), MIDDAY);

            assertThat(result.getRejectionReason()).isEqualTo(RejectionReason.INSUFFICIENT_FUNDS);
            assertThat(result.getMessage()).contains("117700");
            verify(brokerClient, never()).placeOrder(any());
        }

        @Test
        @DisplayName("Selling without a position is rejected")
        void noPosition() {
            assertThat(orderManager.submit(sell(1), MIDDAY).getRejectionReason())
                    .isEqualTo(RejectionReason.NO_POSITION);
        }

        @Test
        @DisplayName("A strategy cannot sell another strategy's position")
        void foreignPosition() {
            holdPosition("opening-breakout", 10);

            assertThat(orderManager.submit(sell(10), MIDDAY).getRejectionReason())
                    .isEqualTo(RejectionReason.NO_POSITION);
        }

        @Test
        @DisplayName("A buy of a symbol held by another strategy is a position conflict")
        void buyIntoForeignPosition() {
            holdPosition("opening-breakout", 10);

            OrderSubmissionResult result = orderManager.submit(buy(5), MIDDAY);

            assertThat(result.getRejectionReason()).isEqualTo(RejectionReason.POSITION_CONFLICT);
            assertThat(result.getMessage()).contains("opening-breakout");
            verify(brokerClient, never()).placeOrder(any());
            assertThat(portfolioLedger.getPosition(SYMBOL)).get().satisfies(position -> {
                assertThat(position.getOwningStrategyId()).isEqualTo("opening-breakout");
                assertThat(position.getQuantity()).isEqualTo(10);
            });
            assertThat(portfolioLedger.getPositionsOwnedBy(STRATEGY)).isEmpty();
        }

        @Test
        @DisplayName("A buy of a symbol with another strategy's order open is a position conflict")
        void buyWhileOtherStrategyOrderOpen() {
            Signal otherBuy = Signal.builder()
                    .strategyId("opening-breakout").symbol(SYMBOL).side(OrderSide.BUY).quantity(2).build();
            assertThat(orderManager.submit(otherBuy, MIDDAY).isAccepted()).isTrue();

            assertThat(orderManager.submit(buy(5), MIDDAY).getRejectionReason())
                    .isEqualTo(RejectionReason.POSITION_CONFLICT);
            verify(brokerClient, times(1)).placeOrder(any());
        }

        @Test
        @DisplayName("A strategy may add to its own position")
        void buyIntoOwnPosition() {
            holdPosition(STRATEGY, 10);

            assertThat(orderManager.submit(buy(5), MIDDAY).isAccepted()).isTrue();
        }

        @Test
        @DisplayName("Quoteless market buys are rejected")
        void priceUnavailable() {
            when(marketDataService.getQuote(SYMBOL)).thenReturn(Optional.empty());

            assertThat(orderManager.submit(buy(1), MIDDAY).getRejectionReason())
                    .isEqualTo(RejectionReason.PRICE_UNAVAILABLE);
        }

        @Test
        @DisplayName("A second signal for an open (strategy, symbol) pair is a duplicate")
        void duplicateWhileOpen() {
            orderManager.submit(buy(1), MIDDAY);

            OrderSubmissionResult second = orderManager.submit(buy(1), MIDDAY.plusSeconds(30));

            assertThat(second.getRejectionReason()).isEqualTo(RejectionReason.DUPLICATE_ORDER);
            verify(brokerClient, times(1)).placeOrder(any());
        }

        @Test
        @DisplayName("Resubmitting the same side within the cooldown is a duplicate even after the order closed")
        void cooldown() {
            OrderSubmissionResult first = orderManager.submit(buy(1), MIDDAY);
            portfolioLedger.abandonOrder(first.getOrder().getOrderId());

            assertThat(orderManager.submit(buy(1), MIDDAY).getRejectionReason())
                    .isEqualTo(RejectionReason.DUPLICATE_ORDER);
        }
    }

    @Nested
    @DisplayName("Risk and Sizing")
    class RiskAndSizing {

        @Test
        @DisplayName("Buys stop once the daily loss limit is reached, sells do not")
        void dailyLossLimit() {
            holdPosition(STRATEGY, 5);
            when(dailyLossGuard.isLimitBreached(any())).thenReturn(true);
            when(dailyLossGuard.getRealizedPnl(any())).thenReturn(new BigDecimal("-600000"));

            assertThat(orderManager.submit(buy(1), MIDDAY).getRejectionReason())
                    .isEqualTo(RejectionReason.DAILY_LOSS_LIMIT);
            assertThat(orderManager.submit(sell(5), MIDDAY).isAccepted()).isTrue();
        }

        @Test
        @DisplayName("New symbols are refused once the open position limit is reached")
        void positionLimit() {
            riskProperties.setMaxOpenPositions(1);
            portfolioLedger.initialize(new BigDecimal("1000000"), List.of(Position.builder()
                    .symbol("000660").quantity(1).averageCost(BigDecimal.ONE).owningStrategyId(STRATEGY).build()));

            assertThat(orderManager.submit(buy(1), MIDDAY).getRejectionReason())
                    .isEqualTo(RejectionReason.POSITION_LIMIT);
        }

        @Test
        @DisplayName("A sizer answer of zero rejects the buy")
        void sizeZero() {
            PositionSizer sizer = mock(PositionSizer.class);
            when(sizer.maxQuantity(any())).thenReturn(0);
            when(positionSizerFactory.getActiveSizer()).thenReturn(sizer);

            assertThat(orderManager.submit(buy(10), MIDDAY).getRejectionReason())
                    .isEqualTo(RejectionReason.SIZE_ZERO);
            assertThat(portfolioLedger.getAvailableCash()).isEqualByComparingTo("1000000");
        }
    }

    @Nested
    @DisplayName("Submission Failures")
    class SubmissionFailures {

        @Test
        @DisplayName("Exhausted retries release the reservation and count toward escalation")
        void transientFailure() {
            when(brokerClient.placeOrder(any())).thenThrow(new TransientApiFailureException("timeout"));

            OrderSubmissionResult result = orderManager.submit(buy(10), MIDDAY);

            assertThat(result.getRejectionReason()).isEqualTo(RejectionReason.SUBMISSION_FAILED);
            assertThat(portfolioLedger.getAvailableCash()).isEqualByComparingTo("1000000");
            assertThat(portfolioLedger.hasOpenOrder(STRATEGY, SYMBOL)).isFalse();
            verify(failureEscalator).recordFailure("SubmissionFailed");
        }

        @Test
        @DisplayName("A broker rejection releases the reservation without escalation")
        void permanentRejection() {
            when(brokerClient.placeOrder(any())).thenThrow(new PermanentRejectionException("account restricted"));

            OrderSubmissionResult result = orderManager.submit(buy(10), MIDDAY);

            assertThat(result.getRejectionReason()).isEqualTo(RejectionReason.SUBMISSION_FAILED);
            assertThat(result.getMessage()).contains("account restricted");
            assertThat(portfolioLedger.hasOpenOrder(STRATEGY, SYMBOL)).isFalse();
            verify(failureEscalator, never()).recordFailure(anyString());
        }
    }
}
