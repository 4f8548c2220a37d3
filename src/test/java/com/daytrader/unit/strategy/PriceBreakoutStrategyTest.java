package com.daytrader.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.daytrader.domain.enums.OrderSide;
import com.daytrader.domain.model.Position;
import com.daytrader.domain.model.Signal;
import com.daytrader.exception.ConfigurationException;
import com.daytrader.portfolio.PortfolioView;
import com.daytrader.strategy.MarketSnapshot;
import com.daytrader.strategy.StrategyDefinition;
import com.daytrader.strategy.TradingStrategy;
import com.daytrader.strategy.impl.PriceBreakoutStrategyFactory;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the price breakout reference strategy.
 */
class PriceBreakoutStrategyTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 14, 10, 0);

    private PortfolioView portfolioView;
    private TradingStrategy strategy;

    @BeforeEach
    void setUp() {
        StrategyDefinition definition = new StrategyDefinition();
        definition.setKey(PriceBreakoutStrategyFactory.KEY);
        definition.setId("midday-breakout");
        definition.setSymbols(List.of("005930"));
        definition.setParams(Map.of("breakout-pct", "0.02", "quantity", "7"));
        strategy = new PriceBreakoutStrategyFactory().create(definition);

        portfolioView = mock(PortfolioView.class);
        when(portfolioView.getPosition("005930")).thenReturn(Optional.empty());
    }

    private static MarketSnapshot snapshot(String price) {
        return MarketSnapshot.builder().asOf(NOW).prices(Map.of("005930", new BigDecimal(price))).build();
    }

    @Test
    @DisplayName("The first price seen is the reference; a break above it emits a buy")
    void breakoutBuys() {
        assertThat(strategy.evaluate(snapshot("70000"), portfolioView, NOW)).isEmpty();
        assertThat(strategy.evaluate(snapshot("71000"), portfolioView, NOW.plusMinutes(1))).isEmpty();

        List<Signal> signals = strategy.evaluate(snapshot("71400"), portfolioView, NOW.plusMinutes(2));

        assertThat(signals).singleElement().satisfies(s -> {
            assertThat(s.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(s.getQuantity()).isEqualTo(7);
            assertThat(s.getStrategyId()).isEqualTo("midday-breakout");
            assertThat(s.isLiquidation()).isFalse();
        });
    }

    @Test
    @DisplayName("A held position exits on stop loss for its full quantity")
    void stopLoss() {
        when(portfolioView.getPosition("005930")).thenReturn(Optional.of(Position.builder()
                .symbol("005930").quantity(7).averageCost(new BigDecimal("71400")).owningStrategyId("midday-breakout")
                .build()));

        List<Signal> signals = strategy.evaluate(snapshot("69900"), portfolioView, NOW);

        assertThat(signals).singleElement().satisfies(s -> {
            assertThat(s.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(s.getQuantity()).isEqualTo(7);
        });
    }

    @Test
    @DisplayName("Positions owned by another strategy are left alone")
    void foreignPositionIgnored() {
        when(portfolioView.getPosition("005930")).thenReturn(Optional.of(Position.builder()
                .symbol("005930").quantity(7).averageCost(new BigDecimal("50000")).owningStrategyId("other")
                .build()));

        strategy.evaluate(snapshot("70000"), portfolioView, NOW);
        assertThat(strategy.evaluate(snapshot("90000"), portfolioView, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Symbols without a quote are skipped")
    void missingQuote() {
        MarketSnapshot empty = MarketSnapshot.builder().asOf(NOW).build();

        assertThat(strategy.evaluate(empty, portfolioView, NOW)).isEmpty();
    }

    @Test
    @DisplayName("The factory refuses a strategy without symbols or with bad parameters")
    void factoryValidation() {
        StrategyDefinition noSymbols = new StrategyDefinition();
        noSymbols.setId("x");
        assertThatThrownBy(() -> new PriceBreakoutStrategyFactory().create(noSymbols))
                .isInstanceOf(ConfigurationException.class);

        StrategyDefinition badParam = new StrategyDefinition();
        badParam.setId("y");
        badParam.setSymbols(List.of("005930"));
        badParam.setParams(Map.of("breakout-pct", "lots"));
        assertThatThrownBy(() -> new PriceBreakoutStrategyFactory().create(badParam))
                .isInstanceOf(ConfigurationException.class);
    }
}
