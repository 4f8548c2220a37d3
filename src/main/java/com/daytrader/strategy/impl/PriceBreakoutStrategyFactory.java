package com.daytrader.strategy.impl;

import com.daytrader.exception.ConfigurationException;
import com.daytrader.strategy.StrategyDefinition;
import com.daytrader.strategy.StrategyFactory;
import com.daytrader.strategy.TradingStrategy;
import org.springframework.stereotype.Component;

@Component
public class PriceBreakoutStrategyFactory implements StrategyFactory {

    public static final String KEY = "price-breakout";

    @Override
    public String getKey() {
        return KEY;
    }

    @Override
    public TradingStrategy create(StrategyDefinition strategyDefinition) {
        if (strategyDefinition.getSymbols().isEmpty()) {
            throw new ConfigurationException("Strategy " + strategyDefinition.getId() + " watches no symbols");
        }
        try {
            return new PriceBreakoutStrategy(strategyDefinition);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid parameter for strategy " + strategyDefinition.getId(), e);
        }
    }
}
