package com.daytrader.strategy.impl;

import com.daytrader.domain.enums.OrderSide;
import com.daytrader.domain.enums.OrderType;
import com.daytrader.domain.model.Position;
import com.daytrader.domain.model.Signal;
import com.daytrader.portfolio.PortfolioView;
import com.daytrader.strategy.MarketSnapshot;
import com.daytrader.strategy.StrategyDefinition;
import com.daytrader.strategy.TradingStrategy;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reference strategy: buys a symbol once its price breaks a percentage above the first price
 * seen in the window, and exits on a take-profit or stop-loss relative to the average cost.
 *
 * <p>Parameters ({@code daytrader.strategies[n].params.*}):
 * <ul>
 *   <li>{@code breakout-pct} -- entry threshold above the reference price (default 0.02)</li>
 *   <li>{@code take-profit-pct} -- exit gain (default 0.03)</li>
 *   <li>{@code stop-loss-pct} -- exit loss (default 0.02)</li>
 *   <li>{@code quantity} -- shares per entry before sizing (default 10)</li>
 * </ul>
 *
 * <p>Reference prices are kept per trading date and dropped when the date changes.
 */
public class PriceBreakoutStrategy implements TradingStrategy {

    private final String id;
    private final List<String> symbols;
    private final BigDecimal breakoutPct;
    private final BigDecimal takeProfitPct;
    private final BigDecimal stopLossPct;
    private final int quantity;

    private final Map<String, BigDecimal> referencePrices = new HashMap<>();
    private LocalDate referenceDate;

    public PriceBreakoutStrategy(StrategyDefinition definition) {
        this.id = definition.getId();
        this.symbols = List.copyOf(definition.getSymbols());
        this.breakoutPct = new BigDecimal(definition.param("breakout-pct", "0.02"));
        this.takeProfitPct = new BigDecimal(definition.param("take-profit-pct", "0.03"));
        this.stopLossPct = new BigDecimal(definition.param("stop-loss-pct", "0.02"));
        this.quantity = Integer.parseInt(definition.param("quantity", "10"));
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public List<String> watchedSymbols() {
        return symbols;
    }

    @Override
    public synchronized List<Signal> evaluate(
            MarketSnapshot marketSnapshot, PortfolioView portfolioView, LocalDateTime now) {
        if (!now.toLocalDate().equals(referenceDate)) {
            referencePrices.clear();
            referenceDate = now.toLocalDate();
        }

        List<Signal> signals = new ArrayList<>();
        for (String symbol : symbols) {
            Optional<BigDecimal> price = marketSnapshot.getPrice(symbol);
            if (price.isEmpty()) {
                continue;
            }
            BigDecimal last = price.get();
            BigDecimal reference = referencePrices.computeIfAbsent(symbol, s -> last);

            Optional<Position> held = portfolioView.getPosition(symbol)
                    .filter(p -> id.equals(p.getOwningStrategyId()));
            if (held.isPresent()) {
                exitSignal(held.get(), last).ifPresent(signals::add);
            } else if (portfolioView.getPosition(symbol).isEmpty() && isBreakout(reference, last)) {
                signals.add(Signal.builder()
                        .strategyId(id)
                        .symbol(symbol)
                        .side(OrderSide.BUY)
                        .quantity(quantity)
                        .orderType(OrderType.MARKET)
                        .reason("breakout above " + reference.toPlainString())
                        .build());
            }
        }
        return signals;
    }

    private boolean isBreakout(BigDecimal reference, BigDecimal last) {
        BigDecimal threshold = reference.multiply(BigDecimal.ONE.add(breakoutPct));
        return last.compareTo(threshold) >= 0;
    }

    private Optional<Signal> exitSignal(Position position, BigDecimal last) {
        BigDecimal change = last.subtract(position.getAverageCost())
                .divide(position.getAverageCost(), 6, RoundingMode.HALF_UP);
        String reason = null;
        if (change.compareTo(takeProfitPct) >= 0) {
            reason = "take profit " + change.toPlainString();
        } else if (change.compareTo(stopLossPct.negate()) <= 0) {
            reason = "stop loss " + change.toPlainString();
        }
        if (reason == null) {
            return Optional.empty();
        }
        return Optional.of(Signal.builder()
                .strategyId(id)
                .symbol(position.getSymbol())
                .side(OrderSide.SELL)
                .quantity(position.getQuantity())
                .orderType(OrderType.MARKET)
                .reason(reason)
                .build());
    }
}
