package com.daytrader.strategy;

/**
 * Creates strategy instances for one registry key. Factories are Spring beans; the
 * {@link StrategyRegistry} indexes them by {@link #getKey()} and resolves every configured
 * strategy once at startup.
 */
public interface StrategyFactory {

    String getKey();

    TradingStrategy create(StrategyDefinition strategyDefinition);
}
