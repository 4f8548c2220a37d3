package com.daytrader.strategy;

/**
 * A resolved strategy instance together with its configuration.
 */
public record RegisteredStrategy(StrategyDefinition definition, TradingStrategy strategy) {

    public String id() {
        return definition.getId();
    }
}
