package com.daytrader.portfolio;

import com.daytrader.domain.enums.OrderSide;
import com.daytrader.domain.enums.OrderStatus;
import com.daytrader.domain.model.Fill;
import com.daytrader.domain.model.Order;
import com.daytrader.domain.model.OrderStatusReport;
import com.daytrader.domain.model.Position;
import com.daytrader.exception.StateCorruptionException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authoritative in-memory record of cash, positions and open orders for the session.
 *
 * <p>Cash and positions change only through {@link #applyStatusReport(String, OrderStatusReport)},
 * i.e. through broker-confirmed fills. Submitting an order never touches them; it only adds a
 * {@link Reservation} and later an open order, which reduce <em>available</em> cash and quantity.
 *
 * <p>All state sits behind a single {@link ReentrantLock}. {@link #executeAtomically(Supplier)}
 * lets the order manager run its whole validate-and-reserve sequence under that lock, so the
 * fill reconciler can never remove an order between a duplicate check and the registration
 * of a new one. The lock is reentrant, so ledger methods may be called from inside.
 *
 * <p>Every fold is validated on scratch values first and committed only if no invariant breaks
 * (cash and quantity non-negative, fills never exceed the order quantity). A violation throws
 * {@link StateCorruptionException} and leaves the ledger untouched.
 */
@Component
public class PortfolioLedger implements PortfolioView {

    private static final Logger log = LoggerFactory.getLogger(PortfolioLedger.class);

    private static final int COST_SCALE = 4;

    private final ReentrantLock lock = new ReentrantLock();

    private BigDecimal cash = BigDecimal.ZERO;
    private final Map<String, Position> positions = new LinkedHashMap<>();

    /** Open orders by broker order id. */
    private final Map<String, Order> openOrders = new LinkedHashMap<>();

    /** In-flight submissions by client order id. */
    private final Map<String, Reservation> reservations = new HashMap<>();

    private final Set<String> appliedFillIds = new HashSet<>();

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Replaces the ledger contents with a broker snapshot. Positions without an owner are
     * attributed to {@link Position#STARTUP_OWNER}.
     */
    public void initialize(BigDecimal startingCash, List<Position> brokerPositions) {
        withLock(() -> {
            if (startingCash == null || startingCash.signum() < 0) {
                throw new StateCorruptionException(
                        "Broker reported invalid cash balance", Map.of("cash", String.valueOf(startingCash)));
            }
            cash = startingCash;
            positions.clear();
            openOrders.clear();
            reservations.clear();
            appliedFillIds.clear();
            for (Position position : brokerPositions) {
                if (position.getQuantity() < 0) {
                    throw new StateCorruptionException(
                            "Broker reported a short position", Map.of("symbol", position.getSymbol()));
                }
                if (position.getQuantity() == 0) {
                    continue;
                }
                Position copy = position.copy();
                if (copy.getOwningStrategyId() == null) {
                    copy.setOwningStrategyId(Position.STARTUP_OWNER);
                }
                positions.put(copy.getSymbol(), copy);
            }
            log.info("Portfolio initialised: cash={}, positions={}", cash, positions.keySet());
            return null;
        });
    }

    /**
     * Puts back an order that was still open at the broker when the process restarted. The
     * fills reported so far are already part of the broker snapshot loaded by
     * {@link #initialize}, so they are marked as applied and never folded again.
     */
    public void restoreOpenOrder(Order order, List<Fill> fillsSoFar) {
        withLock(() -> {
            openOrders.put(order.getOrderId(), order.copy());
            for (Fill fill : fillsSoFar) {
                appliedFillIds.add(fill.fillId());
            }
            log.info(
                    "Open order restored: {} ({} {} {}/{})",
                    order.getOrderId(),
                    order.getStrategyId(),
                    order.getSymbol(),
                    order.getFilledQuantity(),
                    order.getQuantity());
            return null;
        });
    }

    /**
     * Runs the given action while holding the ledger lock.
     */
    public <T> T executeAtomically(Supplier<T> action) {
        return withLock(action);
    }

    // ========================
    // READS
    // ========================

    @Override
    public BigDecimal getCash() {
        return withLock(() -> cash);
    }

    @Override
    public BigDecimal getAvailableCash() {
        return withLock(() -> {
            BigDecimal committed = BigDecimal.ZERO;
            for (Order order : openOrders.values()) {
                if (order.getSignal().getSide() == OrderSide.BUY && order.getReservedUnitCost() != null) {
                    committed = committed.add(
                            order.getReservedUnitCost().multiply(BigDecimal.valueOf(order.getRemainingQuantity())));
                }
            }
            for (Reservation reservation : reservations.values()) {
                committed = committed.add(reservation.committedCash());
            }
            return cash.subtract(committed);
        });
    }

    @Override
    public Optional<Position> getPosition(String symbol) {
        return withLock(() -> Optional.ofNullable(positions.get(symbol)).map(Position::copy));
    }

    @Override
    public List<Position> getPositions() {
        return withLock(() -> positions.values().stream().map(Position::copy).toList());
    }

    @Override
    public List<Position> getPositionsOwnedBy(String strategyId) {
        return withLock(() -> positions.values().stream()
                .filter(p -> strategyId.equals(p.getOwningStrategyId()))
                .map(Position::copy)
                .toList());
    }

    @Override
    public int getAvailableQuantity(String symbol) {
        return withLock(() -> {
            Position position = positions.get(symbol);
            if (position == null) {
                return 0;
            }
            int pendingSells = 0;
            for (Order order : openOrders.values()) {
                if (order.getSignal().getSide() == OrderSide.SELL && symbol.equals(order.getSymbol())) {
                    pendingSells += order.getRemainingQuantity();
                }
            }
            for (Reservation reservation : reservations.values()) {
                if (reservation.side() == OrderSide.SELL && symbol.equals(reservation.symbol())) {
                    pendingSells += reservation.quantity();
                }
            }
            return Math.max(0, position.getQuantity() - pendingSells);
        });
    }

    @Override
    public boolean hasOpenOrder(String strategyId, String symbol) {
        return withLock(() -> openOrders.values().stream()
                        .anyMatch(o -> strategyId.equals(o.getStrategyId()) && symbol.equals(o.getSymbol()))
                || reservations.values().stream()
                        .anyMatch(r -> strategyId.equals(r.strategyId()) && symbol.equals(r.symbol())));
    }

    /** A strategy other than {@code strategyId} with an open order or reservation on {@code symbol}. */
    public Optional<String> findOtherStrategyWithOpenOrder(String symbol, String strategyId) {
        return withLock(() -> {
            for (Order order : openOrders.values()) {
                if (symbol.equals(order.getSymbol()) && !strategyId.equals(order.getStrategyId())) {
                    return Optional.of(order.getStrategyId());
                }
            }
            for (Reservation reservation : reservations.values()) {
                if (symbol.equals(reservation.symbol()) && !strategyId.equals(reservation.strategyId())) {
                    return Optional.of(reservation.strategyId());
                }
            }
            return Optional.<String>empty();
        });
    }

    /**
     * Number of distinct symbols held, open for buying or being bought.
     */
    public int getExposedSymbolCount() {
        return withLock(() -> {
            Set<String> symbols = new HashSet<>(positions.keySet());
            for (Order order : openOrders.values()) {
                if (order.getSignal().getSide() == OrderSide.BUY) {
                    symbols.add(order.getSymbol());
                }
            }
            for (Reservation reservation : reservations.values()) {
                if (reservation.side() == OrderSide.BUY) {
                    symbols.add(reservation.symbol());
                }
            }
            return symbols.size();
        });
    }

    /** Snapshot copies of all open orders, in submission order. */
    public List<Order> getOpenOrders() {
        return withLock(() -> openOrders.values().stream().map(Order::copy).toList());
    }

    public int getOpenOrderCount() {
        return withLock(openOrders::size);
    }

    public PortfolioSnapshot snapshot() {
        return withLock(() -> new PortfolioSnapshot(cash, getAvailableCash(), getPositions(), openOrders.size()));
    }

    // ========================
    // ORDER BOOKKEEPING
    // ========================

    public void reserve(Reservation reservation) {
        withLock(() -> reservations.put(reservation.clientOrderId(), reservation));
    }

    public void releaseReservation(String clientOrderId) {
        withLock(() -> reservations.remove(clientOrderId));
    }

    /**
     * Swaps the reservation for a submitted order into the open-order set in one step.
     */
    public void registerOrder(Order order) {
        withLock(() -> {
            reservations.remove(order.getClientOrderId());
            openOrders.put(order.getOrderId(), order.copy());
            log.debug("Open order registered: {} ({} {})", order.getOrderId(), order.getStrategyId(), order.getSymbol());
            return null;
        });
    }

    /** Flags an open order as already alerted for its pending timeout. */
    public void markTimeoutAlerted(String orderId) {
        withLock(() -> {
            Order order = openOrders.get(orderId);
            if (order != null) {
                order.setTimeoutAlerted(true);
            }
            return null;
        });
    }

    // ========================
    // FILL FOLDING
    // ========================

    /**
     * Folds a broker status report into the ledger: applies fills not seen before, updates
     * the order status, and removes the order from the open set once its status is terminal.
     *
     * @return the changes made, or empty if the order is not open
     * @throws StateCorruptionException if applying the new fills would break an invariant
     */
    public Optional<ReconciliationUpdate> applyStatusReport(String orderId, OrderStatusReport report) {
        return withLock(() -> {
            Order order = openOrders.get(orderId);
            if (order == null) {
                return Optional.empty();
            }

            List<Fill> newFills = report.fills().stream()
                    .filter(f -> !appliedFillIds.contains(f.fillId()))
                    .toList();

            List<AppliedFill> appliedFills = foldFills(order, newFills);

            OrderStatus previousStatus = order.getStatus();
            OrderStatus newStatus = report.status();
            if (newStatus == OrderStatus.PENDING && order.getFilledQuantity() > 0) {
                newStatus = OrderStatus.PARTIALLY_FILLED;
            }
            order.setStatus(newStatus);

            boolean closed = newStatus.isTerminal();
            if (closed) {
                openOrders.remove(orderId);
            }
            return Optional.of(new ReconciliationUpdate(order.copy(), previousStatus, appliedFills, closed));
        });
    }

    /**
     * Drops an open order without fills (abandoned after timeout or unknown to the broker).
     */
    public Optional<Order> abandonOrder(String orderId) {
        return withLock(() -> Optional.ofNullable(openOrders.remove(orderId)).map(Order::copy));
    }

    private List<AppliedFill> foldFills(Order order, List<Fill> newFills) {
        if (newFills.isEmpty()) {
            return List.of();
        }

        // Validate against scratch values; commit only if every fill is consistent
        BigDecimal scratchCash = cash;
        int scratchFilled = order.getFilledQuantity();
        Map<String, Position> scratchPositions = new HashMap<>();
        List<AppliedFill> appliedFills = new ArrayList<>();

        for (Fill fill : newFills) {
            checkFill(order, fill, scratchFilled);
            scratchFilled += fill.quantity();

            Position position = scratchPositions.computeIfAbsent(
                    fill.symbol(), s -> Optional.ofNullable(positions.get(s)).map(Position::copy).orElse(null));

            if (fill.side() == OrderSide.BUY) {
                scratchCash = scratchCash.subtract(fill.notional());
                if (scratchCash.signum() < 0) {
                    throw corruption("Fill would make cash negative", order, fill);
                }
                if (position == null) {
                    position = Position.builder()
                            .symbol(fill.symbol())
                            .quantity(0)
                            .averageCost(BigDecimal.ZERO)
                            .owningStrategyId(order.getStrategyId())
                            .build();
                    scratchPositions.put(fill.symbol(), position);
                }
                int newQuantity = position.getQuantity() + fill.quantity();
                BigDecimal totalCost = position.getAverageCost()
                        .multiply(BigDecimal.valueOf(position.getQuantity()))
                        .add(fill.notional());
                position.setAverageCost(totalCost.divide(BigDecimal.valueOf(newQuantity), COST_SCALE, RoundingMode.HALF_UP));
                position.setQuantity(newQuantity);
                appliedFills.add(new AppliedFill(fill, position.getAverageCost(), BigDecimal.ZERO));
            } else {
                if (position == null || position.getQuantity() < fill.quantity()) {
                    throw corruption("Sell fill exceeds held quantity", order, fill);
                }
                BigDecimal averageCost = position.getAverageCost();
                BigDecimal realizedPnl = fill.price().subtract(averageCost).multiply(BigDecimal.valueOf(fill.quantity()));
                scratchCash = scratchCash.add(fill.notional());
                position.setQuantity(position.getQuantity() - fill.quantity());
                appliedFills.add(new AppliedFill(fill, averageCost, realizedPnl));
            }
        }

        // Commit
        cash = scratchCash;
        order.setFilledQuantity(scratchFilled);
        for (Map.Entry<String, Position> entry : scratchPositions.entrySet()) {
            Position position = entry.getValue();
            if (position.getQuantity() == 0) {
                positions.remove(entry.getKey());
            } else {
                positions.put(entry.getKey(), position);
            }
        }
        for (Fill fill : newFills) {
            appliedFillIds.add(fill.fillId());
        }

        log.info(
                "Applied {} fill(s) for order {}: filled {}/{}, cash={}",
                newFills.size(),
                order.getOrderId(),
                scratchFilled,
                order.getQuantity(),
                cash);
        return appliedFills;
    }

    private void checkFill(Order order, Fill fill, int filledSoFar) {
        if (fill.quantity() <= 0 || fill.price() == null || fill.price().signum() <= 0) {
            throw corruption("Fill has non-positive quantity or price", order, fill);
        }
        if (!order.getSymbol().equals(fill.symbol()) || order.getSignal().getSide() != fill.side()) {
            throw corruption("Fill does not match its order", order, fill);
        }
        if (filledSoFar + fill.quantity() > order.getQuantity()) {
            throw corruption("Fills exceed the order quantity", order, fill);
        }
    }

    private StateCorruptionException corruption(String message, Order order, Fill fill) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("orderId", order.getOrderId());
        details.put("fillId", fill.fillId());
        details.put("symbol", fill.symbol());
        details.put("side", String.valueOf(fill.side()));
        details.put("quantity", fill.quantity());
        details.put("orderQuantity", order.getQuantity());
        details.put("filledQuantity", order.getFilledQuantity());
        details.put("cash", cash.toPlainString());
        return new StateCorruptionException(message, details);
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
