package com.daytrader.strategy;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Data;

/**
 * Prices of a strategy's watched symbols at one tick. Symbols whose quote could not be fetched
 * are absent.
 */
@Data
@Builder
public class MarketSnapshot {

    private LocalDateTime asOf;

    @Builder.Default
    private Map<String, BigDecimal> prices = Map.of();

    public Optional<BigDecimal> getPrice(String symbol) {
        return Optional.ofNullable(prices.get(symbol));
    }
}
