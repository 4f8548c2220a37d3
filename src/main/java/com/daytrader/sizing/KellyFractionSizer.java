package com.daytrader.sizing;

import com.daytrader.domain.enums.SizingPolicy;
import com.daytrader.journal.TradePerformanceTracker;
import com.daytrader.journal.TradeStatistics;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Caps entries at a fractional Kelly share of available cash.
 *
 * <p>f = ((p * b - q) / b) * multiplier, clamped to [0, 1], where p is the win rate, q = 1 - p
 * and b = averageWin / |averageLoss| from the trade journal.
 * <ul>
 *   <li>Fewer than {@code kellyMinSamples} closed trades, or no wins or no losses yet: the
 *       configured defaults are used and at least one share is allowed</li>
 *   <li>Enough history and f = 0 (no edge): 0, which rejects the entry</li>
 *   <li>Otherwise floor(availableCash * f / price), at least one share</li>
 * </ul>
 */
@Component
public class KellyFractionSizer implements PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(KellyFractionSizer.class);

    private final TradePerformanceTracker tradePerformanceTracker;
    private final PositionSizingConfig positionSizingConfig;

    public KellyFractionSizer(
            TradePerformanceTracker tradePerformanceTracker, PositionSizingConfig positionSizingConfig) {
        this.tradePerformanceTracker = tradePerformanceTracker;
        this.positionSizingConfig = positionSizingConfig;
    }

    @Override
    public int maxQuantity(SizingContext sizingContext) {
        TradeStatistics statistics = tradePerformanceTracker.getStatistics(sizingContext.tradingDate());
        boolean enoughHistory = statistics.samples() >= positionSizingConfig.getKellyMinSamples()
                && statistics.wins() > 0
                && statistics.losses() > 0;

        double fraction = enoughHistory
                ? kellyFraction(statistics.winRate(), statistics.averageWin(), statistics.averageLoss())
                : kellyFraction(
                        positionSizingConfig.getDefaultWinRate(),
                        positionSizingConfig.getDefaultAverageWin(),
                        positionSizingConfig.getDefaultAverageLoss());

        if (enoughHistory && fraction <= 0.0) {
            log.info("Kelly fraction is zero over {} trades, no entry allowed", statistics.samples());
            return 0;
        }

        int quantity = sizingContext
                .availableCash()
                .multiply(BigDecimal.valueOf(fraction))
                .divide(sizingContext.estimatedPrice(), 0, RoundingMode.DOWN)
                .intValue();
        quantity = Math.max(1, quantity);

        log.debug("Kelly sizing: fraction={}, history={}, quantity={}", fraction, enoughHistory, quantity);
        return quantity;
    }

    public double kellyFraction(double winRate, double averageWin, double averageLoss) {
        if (winRate <= 0.0 || winRate >= 1.0 || averageWin <= 0.0 || averageLoss >= 0.0) {
            return 0.0;
        }
        double lossRate = 1.0 - winRate;
        double payoff = averageWin / Math.abs(averageLoss);
        double kelly = (winRate * payoff - lossRate) / payoff;
        return Math.max(0.0, Math.min(kelly * positionSizingConfig.getKellyMultiplier(), 1.0));
    }

    @Override
    public SizingPolicy getType() {
        return SizingPolicy.KELLY;
    }
}
