package com.daytrader.oms;

import com.daytrader.broker.BrokerClient;
import com.daytrader.broker.MarketDataService;
import com.daytrader.broker.OrderRequest;
import com.daytrader.calendar.TradingCalendarService;
import com.daytrader.domain.enums.OrderStatus;
import com.daytrader.domain.enums.OrderType;
import com.daytrader.domain.enums.Phase;
import com.daytrader.domain.enums.RejectionReason;
import com.daytrader.domain.model.Order;
import com.daytrader.domain.model.Position;
import com.daytrader.domain.model.Signal;
import com.daytrader.event.EventPublisherHelper;
import com.daytrader.exception.PermanentRejectionException;
import com.daytrader.notification.FailureEscalator;
import com.daytrader.portfolio.PortfolioLedger;
import com.daytrader.portfolio.Reservation;
import com.daytrader.risk.DailyLossGuard;
import com.daytrader.risk.RiskProperties;
import com.daytrader.sizing.PositionSizerFactory;
import com.daytrader.sizing.SizingContext;
import com.daytrader.strategy.StrategyRegistry;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The only path by which a {@link Signal} becomes an {@link Order}.
 *
 * <p>Validation pipeline (the first failure rejects the signal):
 * <ol>
 *   <li>Shape -- positive quantity, limit price present for LIMIT orders</li>
 *   <li>Time gate -- not halted, market open, and the strategy's window accepting entries.
 *       Engine liquidation signals skip the window check but still need an open market</li>
 *   <li>Position -- a sell needs a held position owned by the signalling strategy; a buy may
 *       not touch a symbol held by, or with an open order from, another strategy</li>
 *   <li>Funds -- a buy needs quantity x estimated price x (1 + slippage buffer) of available cash</li>
 *   <li>Duplicate -- at most one open order per (strategyId, symbol), plus a short resubmit
 *       cooldown per (strategyId, symbol, side)</li>
 *   <li>Sell clamp -- sells are reduced to the quantity not already committed to pending sells</li>
 *   <li>Risk -- daily loss limit and maximum open positions (buys only)</li>
 *   <li>Sizing -- the configured sizer may only reduce a buy; 0 rejects</li>
 *   <li>Submission -- through the retrying broker client, with a client order id</li>
 * </ol>
 *
 * <p>Steps 3-8 and the reservation of cash/quantity run under the ledger lock, atomically with
 * respect to the fill reconciler. The broker call runs outside the lock; the reservation keeps
 * concurrent duplicate and funds checks correct until the order is registered as open.
 *
 * <p>Rejections are never exceptions: every one is logged with its reason, published as a
 * {@link com.daytrader.event.SignalRejectedEvent} and returned as a rejected result.
 */
@Service
public class OrderManager {

    private static final Logger log = LoggerFactory.getLogger(OrderManager.class);

    private final PortfolioLedger portfolioLedger;
    private final BrokerClient brokerClient;
    private final MarketDataService marketDataService;
    private final TradingCalendarService tradingCalendarService;
    private final StrategyRegistry strategyRegistry;
    private final PositionSizerFactory positionSizerFactory;
    private final ClientOrderIdGenerator clientOrderIdGenerator;
    private final RecentOrderGuard recentOrderGuard;
    private final DailyLossGuard dailyLossGuard;
    private final RiskProperties riskProperties;
    private final OrderManagerProperties orderManagerProperties;
    private final FailureEscalator failureEscalator;
    private final EventPublisherHelper eventPublisherHelper;

    /** Set by the engine on state corruption; rejects every signal until cleared. */
    private final AtomicBoolean halted = new AtomicBoolean(false);

    private final AtomicReference<String> haltReason = new AtomicReference<>();

    public OrderManager(
            PortfolioLedger portfolioLedger,
            BrokerClient brokerClient,
            MarketDataService marketDataService,
            TradingCalendarService tradingCalendarService,
            StrategyRegistry strategyRegistry,
            PositionSizerFactory positionSizerFactory,
            ClientOrderIdGenerator clientOrderIdGenerator,
            RecentOrderGuard recentOrderGuard,
            DailyLossGuard dailyLossGuard,
            RiskProperties riskProperties,
            OrderManagerProperties orderManagerProperties,
            FailureEscalator failureEscalator,
            EventPublisherHelper eventPublisherHelper) {
        this.portfolioLedger = portfolioLedger;
        this.brokerClient = brokerClient;
        this.marketDataService = marketDataService;
        this.tradingCalendarService = tradingCalendarService;
        this.strategyRegistry = strategyRegistry;
        this.positionSizerFactory = positionSizerFactory;
        this.clientOrderIdGenerator = clientOrderIdGenerator;
        this.recentOrderGuard = recentOrderGuard;
        this.dailyLossGuard = dailyLossGuard;
        this.riskProperties = riskProperties;
        this.orderManagerProperties = orderManagerProperties;
        this.failureEscalator = failureEscalator;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public OrderSubmissionResult submit(Signal signal) {
        return submit(signal, tradingCalendarService.now());
    }

    /**
     * Testable version: validates and submits a signal as of {@code now}.
     */
    public OrderSubmissionResult submit(Signal signal, LocalDateTime now) {
        // Step 1: Shape
        String shapeProblem = checkShape(signal);
        if (shapeProblem != null) {
            return reject(signal, RejectionReason.INVALID_SIGNAL, shapeProblem);
        }

        // Step 2: Time gate
        if (halted.get()) {
            return reject(signal, RejectionReason.TRADING_HALTED, "Trading halted: " + haltReason.get());
        }
        Optional<Phase> phase = tradingCalendarService.resolvePhase(now);
        if (phase.isEmpty() || !phase.get().isMarketOpen()) {
            return reject(
                    signal,
                    RejectionReason.OUTSIDE_TRADING_WINDOW,
                    "Market not open (phase " + phase.map(Enum::name).orElse("NONE") + ")");
        }
        if (!signal.isLiquidation() && !strategyRegistry.isEntryPermitted(signal.getStrategyId(), now)) {
            return reject(
                    signal,
                    RejectionReason.OUTSIDE_TRADING_WINDOW,
                    "Strategy " + signal.getStrategyId() + " may not trade during " + phase.get());
        }

        // Price estimate for buys; network call kept outside the ledger lock
        BigDecimal estimatedPrice = null;
        if (signal.isBuy()) {
            Optional<BigDecimal> price = signal.getOrderType() == OrderType.LIMIT
                    ? Optional.of(signal.getLimitPrice())
                    : marketDataService.getQuote(signal.getSymbol());
            if (price.isEmpty()) {
                return reject(signal, RejectionReason.PRICE_UNAVAILABLE, "No quote for " + signal.getSymbol());
            }
            estimatedPrice = price.get();
        }

        // Steps 3-8: validate against the ledger and reserve, atomically
        BigDecimal priceForCheck = estimatedPrice;
        Validation validation =
                portfolioLedger.executeAtomically(() -> validateAndReserve(signal, priceForCheck, now));
        if (validation.reason() != null) {
            return reject(signal, validation.reason(), validation.message());
        }

        // Step 9: Submission
        return place(signal, validation.reservation(), now);
    }

    // ========================
    // HALT
    // ========================

    public void haltTrading(String reason) {
        haltReason.set(reason);
        if (halted.compareAndSet(false, true)) {
            log.error("Order manager HALTED -- all signals will be rejected: {}", reason);
        }
    }

    public void resumeTrading() {
        if (halted.compareAndSet(true, false)) {
            haltReason.set(null);
            log.info("Order manager resumed -- normal order flow restored");
        }
    }

    public boolean isHalted() {
        return halted.get();
    }

    // ========================
    // PIPELINE STEPS
    // ========================

    private String checkShape(Signal signal) {
        if (signal.getStrategyId() == null || signal.getSymbol() == null || signal.getSide() == null) {
            return "Signal is missing strategy, symbol or side";
        }
        if (signal.getQuantity() <= 0) {
            return "Quantity must be positive, was " + signal.getQuantity();
        }
        if (signal.getOrderType() == OrderType.LIMIT
                && (signal.getLimitPrice() == null || signal.getLimitPrice().signum() <= 0)) {
            return "LIMIT order needs a positive limit price";
        }
        return null;
    }

    private Validation validateAndReserve(Signal signal, BigDecimal estimatedPrice, LocalDateTime now) {
        String strategyId = signal.getStrategyId();
        String symbol = signal.getSymbol();
        int quantity = signal.getQuantity();
        BigDecimal unitCost = null;

        // Step 3: Position / Step 4: Funds
        if (!signal.isBuy()) {
            Optional<Position> position = portfolioLedger.getPosition(symbol);
            if (position.isEmpty()) {
                return Validation.rejected(RejectionReason.NO_POSITION, "No position held in " + symbol);
            }
            if (!strategyId.equals(position.get().getOwningStrategyId())) {
                return Validation.rejected(
                        RejectionReason.NO_POSITION,
                        symbol + " is owned by " + position.get().getOwningStrategyId() + ", not " + strategyId);
            }
        } else {
            Optional<Position> held = portfolioLedger.getPosition(symbol);
            if (held.isPresent() && !strategyId.equals(held.get().getOwningStrategyId())) {
                return Validation.rejected(
                        RejectionReason.POSITION_CONFLICT,
                        symbol + " is held by " + held.get().getOwningStrategyId() + ", not " + strategyId);
            }
            Optional<String> otherStrategy = portfolioLedger.findOtherStrategyWithOpenOrder(symbol, strategyId);
            if (otherStrategy.isPresent()) {
                return Validation.rejected(
                        RejectionReason.POSITION_CONFLICT,
                        symbol + " has an open order from " + otherStrategy.get() + ", not " + strategyId);
            }

            unitCost = estimatedPrice.multiply(BigDecimal.ONE.add(orderManagerProperties.getSlippageBuffer()));
            BigDecimal required = unitCost.multiply(BigDecimal.valueOf(quantity));
            BigDecimal availableCash = portfolioLedger.getAvailableCash();
            if (required.compareTo(availableCash) > 0) {
                return Validation.rejected(
                        RejectionReason.INSUFFICIENT_FUNDS,
                        String.format(
                                "Required %s (%d x %s x %s) exceeds available cash %s",
                                required.toPlainString(),
                                quantity,
                                estimatedPrice.toPlainString(),
                                BigDecimal.ONE.add(orderManagerProperties.getSlippageBuffer()).toPlainString(),
                                availableCash.toPlainString()));
            }
        }

        // Step 5: Duplicate
        if (portfolioLedger.hasOpenOrder(strategyId, symbol)) {
            return Validation.rejected(
                    RejectionReason.DUPLICATE_ORDER, "An order for " + symbol + " is already open for " + strategyId);
        }
        if (recentOrderGuard.isCoolingDown(signal, now)) {
            return Validation.rejected(
                    RejectionReason.DUPLICATE_ORDER,
                    signal.getSide() + " " + symbol + " was submitted for " + strategyId + " within the last "
                            + orderManagerProperties.getResubmitCooldown().toSeconds() + "s");
        }

        if (!signal.isBuy()) {
            // Step 6: Sell clamp
            int available = portfolioLedger.getAvailableQuantity(symbol);
            if (available <= 0) {
                return Validation.rejected(
                        RejectionReason.NO_POSITION, "Held quantity of " + symbol + " is committed to pending sells");
            }
            if (quantity > available) {
                log.info("Sell of {} clamped from {} to available {}", symbol, quantity, available);
                quantity = available;
            }
        } else {
            // Step 7: Risk
            if (dailyLossGuard.isLimitBreached(now.toLocalDate())) {
                return Validation.rejected(
                        RejectionReason.DAILY_LOSS_LIMIT,
                        "Daily loss limit reached, realized " + dailyLossGuard.getRealizedPnl(now.toLocalDate()));
            }
            int maxOpenPositions = riskProperties.getMaxOpenPositions();
            if (maxOpenPositions > 0
                    && portfolioLedger.getPosition(symbol).isEmpty()
                    && portfolioLedger.getExposedSymbolCount() >= maxOpenPositions) {
                return Validation.rejected(
                        RejectionReason.POSITION_LIMIT, "Already exposed to " + maxOpenPositions + " symbols");
            }

            // Step 8: Sizing
            int cap = positionSizerFactory
                    .getActiveSizer()
                    .maxQuantity(new SizingContext(
                            signal, estimatedPrice, portfolioLedger.getAvailableCash(), now.toLocalDate()));
            if (cap <= 0) {
                return Validation.rejected(RejectionReason.SIZE_ZERO, "Position sizer allowed no shares");
            }
            if (cap < quantity) {
                log.info("Buy of {} sized down from {} to {}", symbol, quantity, cap);
                quantity = cap;
            }
        }

        String clientOrderId = clientOrderIdGenerator.generate(signal, now.toLocalDate());
        Reservation reservation =
                new Reservation(clientOrderId, strategyId, symbol, signal.getSide(), quantity, unitCost);
        portfolioLedger.reserve(reservation);
        return Validation.accepted(reservation);
    }

    private OrderSubmissionResult place(Signal signal, Reservation reservation, LocalDateTime now) {
        OrderRequest orderRequest = OrderRequest.builder()
                .clientOrderId(reservation.clientOrderId())
                .strategyId(signal.getStrategyId())
                .symbol(signal.getSymbol())
                .side(signal.getSide())
                .quantity(reservation.quantity())
                .orderType(signal.getOrderType())
                .limitPrice(signal.getOrderType() == OrderType.LIMIT ? signal.getLimitPrice() : null)
                .build();

        String orderId;
        try {
            orderId = brokerClient.placeOrder(orderRequest);
        } catch (PermanentRejectionException e) {
            portfolioLedger.releaseReservation(reservation.clientOrderId());
            return reject(signal, RejectionReason.SUBMISSION_FAILED, "Broker rejected order: " + e.getMessage());
        } catch (RuntimeException e) {
            portfolioLedger.releaseReservation(reservation.clientOrderId());
            failureEscalator.recordFailure("SubmissionFailed");
            return reject(signal, RejectionReason.SUBMISSION_FAILED, "Submission failed: " + e.getMessage());
        }

        Order order = Order.builder()
                .orderId(orderId)
                .clientOrderId(reservation.clientOrderId())
                .signal(signal)
                .submittedAt(now)
                .status(OrderStatus.PENDING)
                .quantity(reservation.quantity())
                .reservedUnitCost(reservation.unitCost())
                .build();
        portfolioLedger.registerOrder(order);
        recentOrderGuard.markSubmitted(signal, now);

        log.info(
                "Order placed: {} {} {} x{} [strategy={}, orderId={}, clientOrderId={}, liquidation={}]",
                signal.getSide(),
                signal.getOrderType(),
                signal.getSymbol(),
                order.getQuantity(),
                signal.getStrategyId(),
                orderId,
                order.getClientOrderId(),
                signal.isLiquidation());
        eventPublisherHelper.publishOrderPlaced(this, order);
        return OrderSubmissionResult.accepted(order);
    }

    private OrderSubmissionResult reject(Signal signal, RejectionReason reason, String message) {
        log.warn(
                "Signal rejected: {} - {} [strategy={}, {} {} x{}]",
                reason,
                message,
                signal.getStrategyId(),
                signal.getSide(),
                signal.getSymbol(),
                signal.getQuantity());
        eventPublisherHelper.publishSignalRejected(this, signal, reason, message);
        return OrderSubmissionResult.rejected(reason, message);
    }

    private record Validation(RejectionReason reason, String message, Reservation reservation) {

        static Validation accepted(Reservation reservation) {
            return new Validation(null, null, reservation);
        }

        static Validation rejected(RejectionReason reason, String message) {
            return new Validation(reason, message, null);
        }
    }
}
