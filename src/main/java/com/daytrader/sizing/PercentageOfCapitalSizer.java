package com.daytrader.sizing;

import com.daytrader.domain.enums.SizingPolicy;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Allocates a fixed percentage of available cash per entry.
 *
 * <p>Formula: quantity = (availableCash * capitalPercentage / 100) / price, rounded down.
 * A minimum of 1 share is kept so that small accounts can still trade; the order manager's
 * cash check still rejects entries the account cannot afford.
 */
@Component
public class PercentageOfCapitalSizer implements PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(PercentageOfCapitalSizer.class);

    private final PositionSizingConfig positionSizingConfig;

    public PercentageOfCapitalSizer(PositionSizingConfig positionSizingConfig) {
        this.positionSizingConfig = positionSizingConfig;
    }

    @Override
    public int maxQuantity(SizingContext sizingContext) {
        BigDecimal percentage = positionSizingConfig.getCapitalPercentage();

        BigDecimal capitalToAllocate = sizingContext
                .availableCash()
                .multiply(percentage)
                .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);

        int quantity = capitalToAllocate
                .divide(sizingContext.estimatedPrice(), 0, RoundingMode.DOWN)
                .intValue();
        quantity = Math.max(1, quantity);

        log.debug(
                "PercentageOfCapital sizing: {}% of {} at {} = {} shares",
                percentage, sizingContext.availableCash(), sizingContext.estimatedPrice(), quantity);
        return quantity;
    }

    @Override
    public SizingPolicy getType() {
        return SizingPolicy.PERCENTAGE_OF_CAPITAL;
    }
}
