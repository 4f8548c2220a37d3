package com.daytrader.journal;

/**
 * Closed-trade statistics. Average win and loss are fractions (0.02 = +2%), the loss negative.
 */
public record TradeStatistics(int samples, int wins, int losses, double winRate, double averageWin, double averageLoss) {

    public static TradeStatistics empty() {
        return new TradeStatistics(0, 0, 0, 0.0, 0.0, 0.0);
    }
}
