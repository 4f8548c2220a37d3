package com.daytrader.simulator;

import com.daytrader.broker.BrokerClient;
import com.daytrader.broker.OrderRequest;
import com.daytrader.calendar.TradingCalendarService;
import com.daytrader.domain.enums.OrderSide;
import com.daytrader.domain.enums.OrderStatus;
import com.daytrader.domain.enums.OrderType;
import com.daytrader.domain.model.Fill;
import com.daytrader.domain.model.OrderStatusReport;
import com.daytrader.domain.model.Position;
import com.daytrader.exception.PermanentRejectionException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-memory paper trading account implementing {@link BrokerClient}.
 *
 * <p>Fill logic:
 * <ul>
 *   <li>MARKET: fills in full on placement at the last price, adjusted by slippage</li>
 *   <li>LIMIT BUY: fills when last price &lt;= limit (at the last price)</li>
 *   <li>LIMIT SELL: fills when last price &gt;= limit (at the last price)</li>
 * </ul>
 * Resting LIMIT orders are re-checked whenever {@link #setQuote} moves a price. A buy the
 * account cannot pay for, or a sell of more than is held, is accepted and then REJECTED,
 * as a real broker reports it through the order status.
 *
 * <p>Unknown symbols and unknown order ids raise {@link PermanentRejectionException}.
 * Active unless {@code daytrader.broker.type} names another broker.
 */
@Component
@Qualifier("rawBrokerClient")
@ConditionalOnProperty(name = "daytrader.broker.type", havingValue = "paper", matchIfMissing = true)
public class PaperBrokerClient implements BrokerClient {

    private static final Logger log = LoggerFactory.getLogger(PaperBrokerClient.class);

    private final PaperBrokerProperties paperBrokerProperties;
    private final TradingCalendarService tradingCalendarService;

    private final Map<String, BigDecimal> lastPrices = new HashMap<>();
    private final Map<String, Holding> holdings = new LinkedHashMap<>();
    private final Map<String, PaperOrder> orders = new LinkedHashMap<>();
    private final Map<String, String> orderIdsByClientOrderId = new HashMap<>();
    private final List<Fill> fills = new ArrayList<>();
    private final AtomicLong orderSequence = new AtomicLong();
    private final AtomicLong fillSequence = new AtomicLong();

    private BigDecimal cash;

    public PaperBrokerClient(PaperBrokerProperties paperBrokerProperties, TradingCalendarService tradingCalendarService) {
        this.paperBrokerProperties = paperBrokerProperties;
        this.tradingCalendarService = tradingCalendarService;
        this.cash = paperBrokerProperties.getStartingCash();
        this.lastPrices.putAll(paperBrokerProperties.getQuotes());
        log.info(
                "Paper broker ready: cash={}, {} quoted symbol(s)",
                cash.toPlainString(),
                lastPrices.size());
    }

    // ========================
    // MARKET DATA
    // ========================

    @Override
    public synchronized BigDecimal getQuote(String symbol) {
        BigDecimal price = lastPrices.get(symbol);
        if (price == null) {
            throw new PermanentRejectionException("Unknown symbol: " + symbol);
        }
        return price;
    }

    /** Moves the last price of a symbol and matches resting LIMIT orders against it. */
    public synchronized void setQuote(String symbol, BigDecimal price) {
        lastPrices.put(symbol, price);
        for (PaperOrder order : orders.values()) {
            if (order.status == OrderStatus.PENDING && order.request.getSymbol().equals(symbol)) {
                tryMatch(order);
            }
        }
    }

    // ========================
    // ACCOUNT
    // ========================

    @Override
    public synchronized List<Position> getPositions() {
        return holdings.entrySet().stream()
                .map(e -> Position.builder()
                        .symbol(e.getKey())
                        .quantity(e.getValue().quantity)
                        .averageCost(e.getValue().averageCost)
                        .build())
                .toList();
    }

    @Override
    public synchronized BigDecimal getAccountCash() {
        return cash;
    }

    /** Seeds a holding, e.g. a position carried from a previous session. */
    public synchronized void addHolding(String symbol, int quantity, BigDecimal averageCost) {
        holdings.put(symbol, new Holding(quantity, averageCost));
    }

    // ========================
    // ORDERS
    // ========================

    @Override
    public synchronized String placeOrder(OrderRequest orderRequest) {
        if (!lastPrices.containsKey(orderRequest.getSymbol())) {
            throw new PermanentRejectionException("Unknown symbol: " + orderRequest.getSymbol());
        }
        if (orderRequest.getQuantity() <= 0) {
            throw new PermanentRejectionException("Quantity must be positive");
        }
        if (orderRequest.getClientOrderId() != null
                && orderIdsByClientOrderId.containsKey(orderRequest.getClientOrderId())) {
            throw new PermanentRejectionException("Duplicate client order id: " + orderRequest.getClientOrderId());
        }

        String orderId = "PAPER-" + orderSequence.incrementAndGet();
        PaperOrder order = new PaperOrder(orderId, orderRequest);
        orders.put(orderId, order);
        if (orderRequest.getClientOrderId() != null) {
            orderIdsByClientOrderId.put(orderRequest.getClientOrderId(), orderId);
        }

        log.debug(
                "Paper order placed: {} {} {} {} x{}",
                orderId,
                orderRequest.getSide(),
                orderRequest.getOrderType(),
                orderRequest.getSymbol(),
                orderRequest.getQuantity());
        tryMatch(order);
        return orderId;
    }

    @Override
    public synchronized OrderStatusReport getOrderStatus(String orderId) {
        PaperOrder order = orders.get(orderId);
        if (order == null) {
            throw new PermanentRejectionException("Unknown order id: " + orderId);
        }
        return new OrderStatusReport(orderId, order.status, order.fills, order.message);
    }

    @Override
    public synchronized List<Fill> getFills(LocalDateTime since) {
        return fills.stream().filter(f -> !f.timestamp().isBefore(since)).toList();
    }

    @Override
    public synchronized Optional<String> findOrderByClientOrderId(String clientOrderId) {
        return Optional.ofNullable(orderIdsByClientOrderId.get(clientOrderId));
    }

    @Override
    public synchronized void cancelOrder(String orderId) {
        PaperOrder order = orders.get(orderId);
        if (order == null) {
            throw new PermanentRejectionException("Unknown order id: " + orderId);
        }
        if (order.status == OrderStatus.PENDING || order.status == OrderStatus.PARTIALLY_FILLED) {
            order.status = OrderStatus.CANCELLED;
            order.message = "Cancelled by request";
            log.debug("Paper order cancelled: {}", orderId);
        }
    }

    // ========================
    // MATCHING
    // ========================

    private void tryMatch(PaperOrder order) {
        OrderRequest request = order.request;
        BigDecimal lastPrice = lastPrices.get(request.getSymbol());

        BigDecimal fillPrice;
        if (request.getOrderType() == OrderType.MARKET) {
            fillPrice = applySlippage(lastPrice, request.getSide());
        } else {
            boolean marketable = request.getSide() == OrderSide.BUY
                    ? lastPrice.compareTo(request.getLimitPrice()) <= 0
                    : lastPrice.compareTo(request.getLimitPrice()) >= 0;
            if (!marketable) {
                return;
            }
            fillPrice = lastPrice;
        }

        int quantity = request.getQuantity();
        BigDecimal notional = fillPrice.multiply(BigDecimal.valueOf(quantity));
        Holding holding = holdings.get(request.getSymbol());

        if (request.getSide() == OrderSide.BUY) {
            if (notional.compareTo(cash) > 0) {
                reject(order, "Insufficient funds: needs " + notional.toPlainString());
                return;
            }
            cash = cash.subtract(notional);
            if (holding == null) {
                holdings.put(request.getSymbol(), new Holding(quantity, fillPrice));
            } else {
                BigDecimal totalCost = holding.averageCost
                        .multiply(BigDecimal.valueOf(holding.quantity))
                        .add(notional);
                holding.quantity += quantity;
                holding.averageCost = totalCost.divide(BigDecimal.valueOf(holding.quantity), 4, RoundingMode.HALF_UP);
            }
        } else {
            if (holding == null || holding.quantity < quantity) {
                reject(order, "Insufficient holdings of " + request.getSymbol());
                return;
            }
            cash = cash.add(notional);
            holding.quantity -= quantity;
            if (holding.quantity == 0) {
                holdings.remove(request.getSymbol());
            }
        }

        Fill fill = new Fill(
                "FILL-" + fillSequence.incrementAndGet(),
                order.orderId,
                request.getSymbol(),
                request.getSide(),
                quantity,
                fillPrice,
                tradingCalendarService.now());
        order.fills.add(fill);
        order.status = OrderStatus.FILLED;
        fills.add(fill);
        log.debug("Paper fill: {} {} x{} @ {}", order.orderId, request.getSymbol(), quantity, fillPrice);
    }

    private void reject(PaperOrder order, String message) {
        order.status = OrderStatus.REJECTED;
        order.message = message;
        log.warn("Paper order {} rejected: {}", order.orderId, message);
    }

    private BigDecimal applySlippage(BigDecimal price, OrderSide side) {
        int slippageBps = paperBrokerProperties.getSlippageBps();
        if (slippageBps == 0) {
            return price;
        }
        BigDecimal factor = BigDecimal.valueOf(slippageBps).divide(BigDecimal.valueOf(10000), 6, RoundingMode.HALF_UP);
        BigDecimal adjustment = side == OrderSide.BUY ? BigDecimal.ONE.add(factor) : BigDecimal.ONE.subtract(factor);
        return price.multiply(adjustment).setScale(2, RoundingMode.HALF_UP);
    }

    private static final class Holding {
        private int quantity;
        private BigDecimal averageCost;

        private Holding(int quantity, BigDecimal averageCost) {
            this.quantity = quantity;
            this.averageCost = averageCost;
        }
    }

    private static final class PaperOrder {
        private final String orderId;
        private final OrderRequest request;
        private final List<Fill> fills = new ArrayList<>();
        private OrderStatus status = OrderStatus.PENDING;
        private String message;

        private PaperOrder(String orderId, OrderRequest request) {
            this.orderId = orderId;
            this.request = request;
        }
    }
}
